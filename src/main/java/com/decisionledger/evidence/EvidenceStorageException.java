package com.decisionledger.evidence;

public class EvidenceStorageException extends RuntimeException {

    public EvidenceStorageException(String message) {
        super(message);
    }

    public EvidenceStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
