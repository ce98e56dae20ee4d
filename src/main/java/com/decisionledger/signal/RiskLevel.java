package com.decisionledger.signal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Risk classification with the total order
 * {@code unacceptable > high > limited > minimal}.
 *
 * Declaration order is significant: {@link #severity()} derives from it.
 */
public enum RiskLevel {
    MINIMAL("minimal", Decision.ALLOW),
    LIMITED("limited", Decision.FLAG),
    HIGH("high", Decision.FLAG),
    UNACCEPTABLE("unacceptable", Decision.BLOCK);

    private final String value;
    private final Decision decision;

    RiskLevel(String value, Decision decision) {
        this.value = value;
        this.decision = decision;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Fixed risk-to-decision table. */
    public Decision toDecision() {
        return decision;
    }

    public int severity() {
        return ordinal();
    }

    public boolean isAtLeast(RiskLevel other) {
        return severity() >= other.severity();
    }

    @JsonCreator
    public static RiskLevel fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown risk level: " + raw));
    }
}
