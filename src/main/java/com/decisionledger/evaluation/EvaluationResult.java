package com.decisionledger.evaluation;

import com.decisionledger.merge.PolicyDecision;

import java.util.Objects;

/**
 * A decision that has been recorded in the ledger under {@code eventId}.
 */
public record EvaluationResult(PolicyDecision decision, String eventId) {

    public EvaluationResult {
        Objects.requireNonNull(decision, "decision is required");
        Objects.requireNonNull(eventId, "event id is required");
    }
}
