package com.decisionledger.ledger;

import com.decisionledger.signal.Decision;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryAuditStore implements AuditStore {

    private final ConcurrentHashMap<String, Sequenced<AuditEvent>> events = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Sequenced<AuditOverride>> overrides = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Sequenced<AuditOverride>>> overridesByEvent =
        new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);

    @Override
    public void appendEvent(AuditEvent event) {
        Sequenced<AuditEvent> entry = new Sequenced<>(sequence.incrementAndGet(), event);
        if (events.putIfAbsent(event.eventId(), entry) != null) {
            throw new DuplicateRecordException("event_id", event.eventId());
        }
    }

    @Override
    public void appendOverride(AuditOverride override) {
        Sequenced<AuditOverride> entry = new Sequenced<>(sequence.incrementAndGet(), override);
        if (overrides.putIfAbsent(override.overrideId(), entry) != null) {
            throw new DuplicateRecordException("override_id", override.overrideId());
        }
        overridesByEvent
            .computeIfAbsent(override.originalEventId(), id -> new CopyOnWriteArrayList<>())
            .add(entry);
    }

    @Override
    public Optional<AuditEvent> findEvent(String eventId) {
        return Optional.ofNullable(events.get(eventId)).map(Sequenced::record);
    }

    @Override
    public boolean existsByEventId(String eventId) {
        return events.containsKey(eventId);
    }

    @Override
    public List<AuditEvent> queryEvents(AuditEventFilter filter) {
        if (filter.limit() <= 0) {
            return Collections.emptyList();
        }

        Comparator<Sequenced<AuditEvent>> newestFirst = Comparator
            .comparing((Sequenced<AuditEvent> s) -> s.record().timestamp())
            .thenComparingLong(Sequenced::sequence)
            .reversed();

        return events.values().stream()
            .filter(s -> filter.decision().map(d -> d == s.record().decision()).orElse(true))
            .filter(s -> filter.riskLevel().map(r -> r == s.record().riskLevel()).orElse(true))
            .filter(s -> filter.user().map(u -> u.equals(s.record().user())).orElse(true))
            .sorted(newestFirst)
            .skip(filter.offset())
            .limit(filter.limit())
            .map(Sequenced::record)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<AuditOverride> overridesFor(String eventId) {
        List<Sequenced<AuditOverride>> attached = overridesByEvent.get(eventId);
        if (attached == null) {
            return Collections.emptyList();
        }
        return attached.stream()
            .sorted(Comparator
                .comparing((Sequenced<AuditOverride> s) -> s.record().timestamp())
                .thenComparingLong(Sequenced::sequence))
            .map(Sequenced::record)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public long countEvents(Optional<Decision> decision) {
        return events.values().stream()
            .filter(s -> decision.map(d -> d == s.record().decision()).orElse(true))
            .count();
    }

    @Override
    public long countOverrides() {
        return overrides.size();
    }

    private record Sequenced<T>(long sequence, T record) {}
}
