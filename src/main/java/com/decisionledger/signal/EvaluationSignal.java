package com.decisionledger.signal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One producer's opinion about the risk in a piece of content.
 *
 * Immutable. {@code rawEvidence} travels to the evidence sideband and is
 * never embedded in the ledger record.
 */
public record EvaluationSignal(
    @JsonProperty("source") SignalSource source,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("tags") Set<String> tags,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("rationale") String rationale,
    @JsonIgnore Map<String, Object> rawEvidence
) {

    public EvaluationSignal {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(riskLevel, "risk_level is required");
        if (!Double.isFinite(confidence)) {
            throw new IllegalArgumentException("confidence must be a finite number");
        }
        Set<String> orderedTags = new LinkedHashSet<>();
        if (tags != null) {
            for (String tag : tags) {
                if (tag != null && !tag.isBlank()) {
                    orderedTags.add(tag);
                }
            }
        }
        tags = Collections.unmodifiableSet(orderedTags);
        rationale = rationale == null ? "" : rationale;
        rawEvidence = rawEvidence == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(rawEvidence));
    }

    public static EvaluationSignal of(SignalSource source, RiskLevel riskLevel,
                                      Set<String> tags, double confidence, String rationale) {
        return new EvaluationSignal(source, riskLevel, tags, confidence, rationale, Map.of());
    }
}
