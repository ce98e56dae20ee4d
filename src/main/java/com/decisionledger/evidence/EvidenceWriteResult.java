package com.decisionledger.evidence;

/**
 * Outcome of a best-effort evidence write.
 */
public record EvidenceWriteResult(String key, boolean stored, String error) {

    public static EvidenceWriteResult stored(String key) {
        return new EvidenceWriteResult(key, true, null);
    }

    public static EvidenceWriteResult failed(String key, String error) {
        return new EvidenceWriteResult(key, false, error);
    }
}
