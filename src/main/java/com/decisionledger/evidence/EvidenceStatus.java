package com.decisionledger.evidence;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EvidenceStatus {
    SIGNAL("signal"),
    NO_SIGNAL("no-signal"),
    SOURCE_ERROR("source-error");

    private final String value;

    EvidenceStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
