package com.decisionledger.projection;

import com.decisionledger.ledger.AuditEvent;
import com.decisionledger.ledger.AuditLedger;
import com.decisionledger.ledger.AuditOverride;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the effective decision for an event from the ledger at read time.
 *
 * The latest override that has not expired wins; otherwise the original
 * decision stands. Nothing here is persisted, and expired overrides stay in
 * the ledger untouched.
 */
public class EffectiveDecisionProjection {

    private final AuditLedger ledger;
    private final Clock clock;

    public EffectiveDecisionProjection(AuditLedger ledger, Clock clock) {
        this.ledger = Objects.requireNonNull(ledger, "ledger is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public Optional<EffectiveDecision> getProjection(String eventId) {
        return ledger.find(eventId).map(this::project);
    }

    EffectiveDecision project(AuditEvent event) {
        Instant now = clock.instant();
        List<AuditOverride> overrides = ledger.overridesFor(event.eventId());

        AuditOverride applied = null;
        int expired = 0;
        // ascending order, so the last live one is the latest
        for (AuditOverride override : overrides) {
            if (override.isExpiredAt(now)) {
                expired++;
            } else {
                applied = override;
            }
        }

        return new EffectiveDecision(
            event.eventId(),
            event.decision(),
            applied == null ? event.decision() : applied.newDecision(),
            applied == null ? null : applied.overrideId(),
            overrides.size(),
            expired,
            now);
    }
}
