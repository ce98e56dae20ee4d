package com.decisionledger.projection;

import com.decisionledger.signal.Decision;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Read-only view of the decision currently in force for an audit event.
 *
 * {@code appliedOverrideId} is null when the original decision stands.
 */
public record EffectiveDecision(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("original_decision") Decision originalDecision,
    @JsonProperty("effective_decision") Decision effectiveDecision,
    @JsonProperty("applied_override_id") String appliedOverrideId,
    @JsonProperty("override_count") int overrideCount,
    @JsonProperty("expired_override_count") int expiredOverrideCount,
    @JsonProperty("as_of") Instant asOf
) {

    @JsonProperty("overridden")
    public boolean overridden() {
        return appliedOverrideId != null;
    }
}
