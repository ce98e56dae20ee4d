package com.decisionledger.ledger;

import com.decisionledger.signal.Decision;
import com.decisionledger.signal.RiskLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Permanent, signed record of one decision. Never mutated once persisted;
 * corrections are layered on top as {@link AuditOverride}s.
 */
public record AuditEvent(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("input_hash") String inputHash,
    @JsonProperty("user") String user,
    @JsonProperty("client_id") String clientId,
    @JsonProperty("input_type") String inputType,
    @JsonProperty("decision") Decision decision,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("policy_tags") List<String> policyTags,
    @JsonProperty("policy_version") String policyVersion,
    @JsonProperty("confidence_score") int confidenceScore,
    @JsonProperty("explanation") String explanation,
    @JsonProperty("evidence_refs") List<String> evidenceRefs,
    @JsonProperty("signature") String signature
) {

    public AuditEvent {
        Objects.requireNonNull(eventId, "event_id is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(decision, "decision is required");
        Objects.requireNonNull(riskLevel, "risk_level is required");
        policyTags = policyTags == null ? List.of() : List.copyOf(policyTags);
        evidenceRefs = evidenceRefs == null ? List.of() : List.copyOf(evidenceRefs);
    }
}
