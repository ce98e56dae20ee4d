package com.decisionledger.ledger;

import com.decisionledger.signal.Decision;
import com.decisionledger.signal.RiskLevel;

import java.util.Optional;

/**
 * Listing filter. {@code limit} is capped at {@link #MAX_LIMIT}; a negative
 * offset is read as zero.
 */
public record AuditEventFilter(
    Optional<Decision> decision,
    Optional<RiskLevel> riskLevel,
    Optional<String> user,
    int limit,
    int offset
) {

    public static final int MAX_LIMIT = 1000;
    public static final int DEFAULT_LIMIT = 100;

    public AuditEventFilter {
        decision = decision == null ? Optional.empty() : decision;
        riskLevel = riskLevel == null ? Optional.empty() : riskLevel;
        user = user == null ? Optional.empty() : user.filter(u -> !u.isBlank());
        limit = Math.min(limit, MAX_LIMIT);
        offset = Math.max(offset, 0);
    }

    public static AuditEventFilter all() {
        return new AuditEventFilter(Optional.empty(), Optional.empty(), Optional.empty(), DEFAULT_LIMIT, 0);
    }

    public AuditEventFilter withDecision(Decision value) {
        return new AuditEventFilter(Optional.ofNullable(value), riskLevel, user, limit, offset);
    }

    public AuditEventFilter withRiskLevel(RiskLevel value) {
        return new AuditEventFilter(decision, Optional.ofNullable(value), user, limit, offset);
    }

    public AuditEventFilter withUser(String value) {
        return new AuditEventFilter(decision, riskLevel, Optional.ofNullable(value), limit, offset);
    }

    public AuditEventFilter page(int newLimit, int newOffset) {
        return new AuditEventFilter(decision, riskLevel, user, newLimit, newOffset);
    }
}
