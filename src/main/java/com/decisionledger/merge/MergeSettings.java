package com.decisionledger.merge;

/**
 * Immutable engine configuration, fixed at construction time.
 *
 * @param cleanConfidence confidence reported when no signal fired; kept within
 *                        [10,20] so "checked, clean" never reads as "not checked"
 * @param cleanExplanation explanation reported when no signal fired
 */
public record MergeSettings(int cleanConfidence, String cleanExplanation) {

    public static final int DEFAULT_CLEAN_CONFIDENCE = 15;
    public static final String DEFAULT_CLEAN_EXPLANATION = "No policy violations detected";

    public MergeSettings {
        if (cleanConfidence < 10 || cleanConfidence > 20) {
            throw new IllegalArgumentException("clean confidence must be within [10,20]: " + cleanConfidence);
        }
        if (cleanExplanation == null || cleanExplanation.isBlank()) {
            cleanExplanation = DEFAULT_CLEAN_EXPLANATION;
        }
    }

    public static MergeSettings defaults() {
        return new MergeSettings(DEFAULT_CLEAN_CONFIDENCE, DEFAULT_CLEAN_EXPLANATION);
    }
}
