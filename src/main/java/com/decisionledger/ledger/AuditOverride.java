package com.decisionledger.ledger;

import com.decisionledger.signal.Decision;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Signed correction layered on an {@link AuditEvent}; never replaces it.
 *
 * @param duration override lifetime in minutes, {@code null} for permanent
 */
public record AuditOverride(
    @JsonProperty("override_id") String overrideId,
    @JsonProperty("original_event_id") String originalEventId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("operator") String operator,
    @JsonProperty("reason") String reason,
    @JsonProperty("new_decision") Decision newDecision,
    @JsonProperty("duration") Integer duration,
    @JsonProperty("signature") String signature
) {

    public AuditOverride {
        Objects.requireNonNull(overrideId, "override_id is required");
        Objects.requireNonNull(originalEventId, "original_event_id is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(newDecision, "new_decision is required");
    }

    @JsonIgnore
    public boolean isPermanent() {
        return duration == null;
    }

    /** Whether a time-limited override has run out at {@code now}. */
    public boolean isExpiredAt(Instant now) {
        if (duration == null) {
            return false;
        }
        return !now.isBefore(timestamp.plus(Duration.ofMinutes(duration)));
    }
}
