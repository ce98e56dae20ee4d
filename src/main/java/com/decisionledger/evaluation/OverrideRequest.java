package com.decisionledger.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Operator correction of a recorded decision.
 *
 * @param duration minutes the override stays in force; null for permanent
 */
public record OverrideRequest(
    @JsonProperty("operator") String operator,
    @JsonProperty("reason") String reason,
    @JsonProperty("new_decision") String newDecision,
    @JsonProperty("duration") Integer duration
) {}
