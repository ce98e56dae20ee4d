package com.decisionledger.evidence;

import com.decisionledger.signal.SignalSource;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raw evidence for one signal source within a single evaluation.
 */
public record EvidenceEntry(
    @JsonProperty("source") SignalSource source,
    @JsonProperty("status") EvidenceStatus status,
    @JsonProperty("payload") Map<String, Object> payload
) {

    public EvidenceEntry {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(status, "status is required");
        payload = payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /** Nothing worth persisting: a clean check that left no details behind. */
    @JsonIgnore
    public boolean isEmpty() {
        return status == EvidenceStatus.NO_SIGNAL && payload.isEmpty();
    }

    /** Document written to the sideband, tagged with its status. */
    @JsonIgnore
    public Map<String, Object> document() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("source", source.getValue());
        doc.put("status", status.getValue());
        doc.put("payload", payload);
        return doc;
    }
}
