package com.decisionledger.api;

import com.decisionledger.evaluation.EvaluationResult;
import com.decisionledger.merge.PolicyDecision;
import com.decisionledger.signal.Decision;
import com.decisionledger.signal.RiskLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EvaluateResponse(
    @JsonProperty("decision") Decision decision,
    @JsonProperty("policy_tags") List<String> policyTags,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("audit_event_id") String auditEventId,
    @JsonProperty("explanation") String explanation,
    @JsonProperty("confidence_score") int confidenceScore,
    @JsonProperty("policy_version") String policyVersion
) {

    static EvaluateResponse from(EvaluationResult result) {
        PolicyDecision d = result.decision();
        return new EvaluateResponse(d.decision(), d.policyTags(), d.riskLevel(), result.eventId(),
            d.explanation(), d.confidenceScore(), d.policyVersion());
    }
}
