package com.decisionledger.signal;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Producer family of an {@link EvaluationSignal}.
 *
 * Rule-based priority (used only when no classifier signal is present)
 * is PATTERN over VISION. The classifier sits outside that ranking: when it
 * produced a signal, it is authoritative.
 */
public enum SignalSource {
    PATTERN("pattern", 0),
    VISION("vision", 1),
    CLASSIFIER("classifier", -1);

    private final String value;
    private final int rulePriority;

    SignalSource(String value, int rulePriority) {
        this.value = value;
        this.rulePriority = rulePriority;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Lower is stronger; only meaningful for rule-based sources. */
    public int rulePriority() {
        return rulePriority;
    }

    public boolean isRuleBased() {
        return this != CLASSIFIER;
    }

    @JsonCreator
    public static SignalSource fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown signal source: " + raw));
    }
}
