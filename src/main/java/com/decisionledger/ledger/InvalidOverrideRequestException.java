package com.decisionledger.ledger;

/**
 * Override request rejected before anything was persisted.
 */
public class InvalidOverrideRequestException extends RuntimeException {

    public InvalidOverrideRequestException(String message) {
        super(message);
    }
}
