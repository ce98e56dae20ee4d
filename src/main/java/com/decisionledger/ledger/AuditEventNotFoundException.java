package com.decisionledger.ledger;

public class AuditEventNotFoundException extends RuntimeException {

    private final String eventId;

    public AuditEventNotFoundException(String eventId) {
        super("audit event not found: " + eventId);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
