package com.decisionledger.merge;

import com.decisionledger.signal.EvaluationSignal;

import java.util.List;
import java.util.Optional;

/**
 * One deterministic way of turning signals into a decision.
 * Strategies are tried in order; the first that applies wins.
 */
public interface MergeStrategy {

    /** Unique strategy identifier, e.g. "classifier-authority". */
    String strategyId();

    /**
     * @param signals produced signals in producer order, never null
     * @param policyVersion version of the active policy pack
     * @return a decision, or empty if this strategy does not apply
     */
    Optional<PolicyDecision> apply(List<EvaluationSignal> signals, String policyVersion);

    /** round(confidence * 100), clamped to [0,100]. */
    static int toScore(double confidence) {
        long scaled = Math.round(confidence * 100.0);
        return (int) Math.max(0, Math.min(100, scaled));
    }
}
