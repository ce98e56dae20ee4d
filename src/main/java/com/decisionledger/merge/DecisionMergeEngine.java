package com.decisionledger.merge;

import com.decisionledger.evidence.EvidenceBundle;
import com.decisionledger.evidence.EvidenceEntry;
import com.decisionledger.evidence.EvidenceStatus;
import com.decisionledger.signal.EvaluationSignal;
import com.decisionledger.signal.RiskLevel;
import com.decisionledger.signal.SignalOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decision merge engine: deterministic reconciliation of independent risk
 * signals into one {@link PolicyDecision}.
 *
 * - Pure: no I/O, no clock, no randomness. Identical inputs (including order)
 *   give equal outputs.
 * - Strategies are evaluated in order; first applicable wins.
 * - No produced signal at all yields the "checked, clean" baseline.
 * - Failed producers never abort the merge; they surface as source-error
 *   entries in the evidence bundle.
 */
public class DecisionMergeEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionMergeEngine.class);

    private final List<MergeStrategy> strategies;
    private final MergeSettings settings;

    public DecisionMergeEngine(List<MergeStrategy> strategies, MergeSettings settings) {
        this.strategies = List.copyOf(strategies);
        this.settings = Objects.requireNonNull(settings, "settings is required");
    }

    /** Engine with the standard precedence: classifier first, then rule-based fallback. */
    public static DecisionMergeEngine standard(MergeSettings settings) {
        return new DecisionMergeEngine(
            List.of(new ClassifierAuthorityStrategy(), new RuleBasedFallbackStrategy()),
            settings);
    }

    /**
     * Merge already-produced signals.
     *
     * @param signals ordered signals, may be empty
     * @param activePolicyVersion version string of the active policy pack
     */
    public PolicyDecision merge(List<EvaluationSignal> signals, String activePolicyVersion) {
        Objects.requireNonNull(signals, "signals cannot be null");
        String policyVersion = Objects.requireNonNull(activePolicyVersion, "policy version is required");

        for (MergeStrategy strategy : strategies) {
            Optional<PolicyDecision> decision = strategy.apply(signals, policyVersion);
            if (decision.isPresent()) {
                log.debug("Merge strategy {} decided {} at risk {}", strategy.strategyId(),
                    decision.get().decision().getValue(), decision.get().riskLevel().getValue());
                return decision.get();
            }
        }

        return new PolicyDecision(
            RiskLevel.MINIMAL.toDecision(),
            RiskLevel.MINIMAL,
            List.of(),
            settings.cleanConfidence(),
            settings.cleanExplanation(),
            policyVersion);
    }

    /**
     * Merge producer outcomes, keeping failed and empty outcomes as evidence.
     */
    public MergedEvaluation mergeOutcomes(List<SignalOutcome> outcomes, String activePolicyVersion) {
        Objects.requireNonNull(outcomes, "outcomes cannot be null");

        List<EvaluationSignal> signals = new ArrayList<>();
        List<EvidenceEntry> entries = new ArrayList<>();

        for (SignalOutcome outcome : outcomes) {
            if (outcome instanceof SignalOutcome.Produced produced) {
                signals.add(produced.signal());
                entries.add(new EvidenceEntry(produced.source(), EvidenceStatus.SIGNAL,
                    signalEvidence(produced.signal())));
            } else if (outcome instanceof SignalOutcome.NoSignal none) {
                entries.add(new EvidenceEntry(none.source(), EvidenceStatus.NO_SIGNAL, none.evidence()));
            } else if (outcome instanceof SignalOutcome.Failed failed) {
                // Attempted and failed: distinguishable from a source that was never attempted
                Map<String, Object> marker = new LinkedHashMap<>();
                marker.put("status", EvidenceStatus.SOURCE_ERROR.getValue());
                marker.put("reason", failed.reason());
                entries.add(new EvidenceEntry(failed.source(), EvidenceStatus.SOURCE_ERROR, marker));
            }
        }

        PolicyDecision decision = merge(signals, activePolicyVersion);
        return new MergedEvaluation(decision, new EvidenceBundle(entries));
    }

    private Map<String, Object> signalEvidence(EvaluationSignal signal) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("risk_level", signal.riskLevel().getValue());
        payload.put("tags", List.copyOf(signal.tags()));
        payload.put("confidence", signal.confidence());
        payload.put("rationale", signal.rationale());
        payload.put("raw", signal.rawEvidence());
        return payload;
    }
}
