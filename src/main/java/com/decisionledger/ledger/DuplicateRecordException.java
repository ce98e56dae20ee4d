package com.decisionledger.ledger;

/**
 * Thrown by a store when a record's primary identifier already exists.
 */
public class DuplicateRecordException extends RuntimeException {

    public DuplicateRecordException(String field, String id) {
        super(field + " already exists: " + id);
    }
}
