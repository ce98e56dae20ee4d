package com.decisionledger.evidence;

import com.decisionledger.signal.SignalSource;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * Ordered evidence produced alongside a merged decision. A source that was
 * never attempted has no entry; a source that failed has a SOURCE_ERROR entry.
 */
public record EvidenceBundle(@JsonProperty("entries") List<EvidenceEntry> entries) {

    public EvidenceBundle {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static EvidenceBundle empty() {
        return new EvidenceBundle(List.of());
    }

    public Optional<EvidenceEntry> entryFor(SignalSource source) {
        return entries.stream().filter(e -> e.source() == source).findFirst();
    }

    public boolean hasSourceError(SignalSource source) {
        return entryFor(source).map(e -> e.status() == EvidenceStatus.SOURCE_ERROR).orElse(false);
    }
}
