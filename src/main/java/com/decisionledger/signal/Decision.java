package com.decisionledger.signal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Decision {
    ALLOW("allow"),
    FLAG("flag"),
    BLOCK("block");

    private final String value;

    Decision(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Decision fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown decision: " + raw));
    }
}
