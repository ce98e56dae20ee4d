package com.decisionledger.merge;

import com.decisionledger.signal.Decision;
import com.decisionledger.signal.RiskLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Merged outcome of one evaluation. Transient: it is only ever persisted
 * as part of an audit event.
 */
public record PolicyDecision(
    @JsonProperty("decision") Decision decision,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("policy_tags") List<String> policyTags,
    @JsonProperty("confidence_score") int confidenceScore,
    @JsonProperty("explanation") String explanation,
    @JsonProperty("policy_version") String policyVersion
) {

    public PolicyDecision {
        Objects.requireNonNull(decision, "decision is required");
        Objects.requireNonNull(riskLevel, "risk_level is required");
        if (confidenceScore < 0 || confidenceScore > 100) {
            throw new IllegalArgumentException("confidence_score must be within [0,100]: " + confidenceScore);
        }
        policyTags = policyTags == null
            ? List.of()
            : Collections.unmodifiableList(List.copyOf(new LinkedHashSet<>(policyTags)));
        explanation = explanation == null ? "" : explanation;
        Objects.requireNonNull(policyVersion, "policy_version is required");
    }
}
