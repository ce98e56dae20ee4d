package com.decisionledger.ledger;

import com.decisionledger.signal.Decision;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage for audit events and overrides.
 *
 * There is no update or delete. Each append is atomic and assigns a
 * monotonically increasing sequence used only to order records that share
 * a timestamp. Implementations throw {@link DuplicateRecordException} on a
 * primary-key clash and {@link AuditStoreException} when unavailable.
 */
public interface AuditStore {

    void appendEvent(AuditEvent event);

    void appendOverride(AuditOverride override);

    Optional<AuditEvent> findEvent(String eventId);

    boolean existsByEventId(String eventId);

    /** Newest first by timestamp, then by sequence. */
    List<AuditEvent> queryEvents(AuditEventFilter filter);

    /** Oldest first by timestamp, then by sequence. */
    List<AuditOverride> overridesFor(String eventId);

    long countEvents(Optional<Decision> decision);

    long countOverrides();
}
