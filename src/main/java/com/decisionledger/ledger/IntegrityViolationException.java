package com.decisionledger.ledger;

/**
 * A stored record no longer matches its signature. Fatal for the operation
 * that asked for verification; never to be confused with a missing record.
 */
public class IntegrityViolationException extends RuntimeException {

    private final String recordId;

    public IntegrityViolationException(String recordId, String message) {
        super("integrity violation on " + recordId + ": " + message);
        this.recordId = recordId;
    }

    public String getRecordId() {
        return recordId;
    }
}
