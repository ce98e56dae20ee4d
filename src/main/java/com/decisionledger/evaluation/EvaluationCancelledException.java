package com.decisionledger.evaluation;

/**
 * The calling thread was interrupted before the decision was recorded.
 * Nothing was persisted.
 */
public class EvaluationCancelledException extends RuntimeException {

    public EvaluationCancelledException(String message) {
        super(message);
    }
}
