package com.decisionledger.evidence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEvidenceStore implements EvidenceStore {

    private final ConcurrentHashMap<String, Map<String, Object>> objects = new ConcurrentHashMap<>();

    @Override
    public void put(String key, Map<String, Object> payload) {
        objects.put(key, Collections.unmodifiableMap(new LinkedHashMap<>(payload)));
    }

    @Override
    public Optional<Map<String, Object>> get(String key) {
        return Optional.ofNullable(objects.get(key));
    }

    public Set<String> keys() {
        return Set.copyOf(objects.keySet());
    }
}
