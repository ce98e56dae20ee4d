package com.decisionledger.merge;

import com.decisionledger.signal.EvaluationSignal;
import com.decisionledger.signal.SignalSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A produced classifier signal is authoritative: its risk level, tags,
 * confidence and rationale populate the decision directly.
 */
public class ClassifierAuthorityStrategy implements MergeStrategy {

    @Override
    public String strategyId() {
        return "classifier-authority";
    }

    @Override
    public Optional<PolicyDecision> apply(List<EvaluationSignal> signals, String policyVersion) {
        return signals.stream()
            .filter(s -> s.source() == SignalSource.CLASSIFIER)
            .findFirst()
            .map(classifier -> new PolicyDecision(
                classifier.riskLevel().toDecision(),
                classifier.riskLevel(),
                new ArrayList<>(classifier.tags()),
                MergeStrategy.toScore(classifier.confidence()),
                classifier.rationale(),
                policyVersion
            ));
    }
}
