package com.decisionledger.ledger;

/**
 * The underlying store could not complete an operation.
 */
public class AuditStoreException extends RuntimeException {

    public AuditStoreException(String message) {
        super(message);
    }

    public AuditStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
