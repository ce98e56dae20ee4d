package com.decisionledger.policy;

import com.decisionledger.signal.Decision;
import com.decisionledger.signal.RiskLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

public record PolicyTag(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("patterns") List<String> patterns,
    @JsonProperty("action") Decision action
) {

    public PolicyTag {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(riskLevel, "risk_level is required");
        description = description == null ? "" : description;
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        action = action == null ? riskLevel.toDecision() : action;
    }
}
