package com.decisionledger.merge;

import com.decisionledger.signal.EvaluationSignal;
import com.decisionledger.signal.RiskLevel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Combines pattern and vision signals when no classifier verdict exists.
 *
 * The winner is the highest-risk signal, ties broken by source priority
 * (pattern before vision) and then by input order. Tags and rationales are
 * accumulated from every signal at or above the winner's risk level.
 */
public class RuleBasedFallbackStrategy implements MergeStrategy {

    private static final String EXPLANATION_SEPARATOR = "; ";

    @Override
    public String strategyId() {
        return "rule-based-fallback";
    }

    @Override
    public Optional<PolicyDecision> apply(List<EvaluationSignal> signals, String policyVersion) {
        List<Ranked> ranked = new ArrayList<>();
        for (int i = 0; i < signals.size(); i++) {
            EvaluationSignal signal = signals.get(i);
            if (signal.source().isRuleBased()) {
                ranked.add(new Ranked(signal, i));
            }
        }
        if (ranked.isEmpty()) {
            return Optional.empty();
        }

        // Contributing order: source priority, then input order
        ranked.sort(Comparator
            .comparingInt((Ranked r) -> r.signal().source().rulePriority())
            .thenComparingInt(Ranked::index));

        EvaluationSignal winner = ranked.get(0).signal();
        for (Ranked r : ranked) {
            if (r.signal().riskLevel().severity() > winner.riskLevel().severity()) {
                winner = r.signal();
            }
        }
        RiskLevel selected = winner.riskLevel();

        Set<String> tags = new LinkedHashSet<>();
        List<String> rationales = new ArrayList<>();
        for (Ranked r : ranked) {
            EvaluationSignal signal = r.signal();
            if (!signal.riskLevel().isAtLeast(selected)) {
                continue;
            }
            tags.addAll(signal.tags());
            if (!signal.rationale().isBlank()) {
                rationales.add(signal.rationale());
            }
        }

        return Optional.of(new PolicyDecision(
            selected.toDecision(),
            selected,
            new ArrayList<>(tags),
            MergeStrategy.toScore(winner.confidence()),
            String.join(EXPLANATION_SEPARATOR, rationales),
            policyVersion
        ));
    }

    private record Ranked(EvaluationSignal signal, int index) {}
}
