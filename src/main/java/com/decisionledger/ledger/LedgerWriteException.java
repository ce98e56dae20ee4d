package com.decisionledger.ledger;

/**
 * A record could not be persisted. For evaluations this means the decision
 * must not be returned, since it was never audited.
 */
public class LedgerWriteException extends RuntimeException {

    public LedgerWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
