package com.decisionledger.evidence;

import java.util.Map;
import java.util.Optional;

/**
 * Blob store for raw signal evidence. Writes have idempotent overwrite
 * semantics. Implementations may throw {@link EvidenceStorageException}.
 */
public interface EvidenceStore {

    void put(String key, Map<String, Object> payload);

    Optional<Map<String, Object>> get(String key);
}
