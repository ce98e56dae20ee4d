package com.decisionledger.config;

import com.decisionledger.signal.ProducerStatus;
import com.decisionledger.signal.SignalSource;

import java.util.List;

/**
 * Which producers an evaluation consults, as configured at startup.
 */
public class ProducerStatusReport {

    private final List<ProducerStatus> producers;

    public ProducerStatusReport(ComplianceProperties properties) {
        ComplianceProperties.Classifier classifier = properties.getClassifier();
        ComplianceProperties.Vision vision = properties.getVision();
        this.producers = List.of(
            ProducerStatus.local(SignalSource.PATTERN),
            new ProducerStatus(SignalSource.VISION, vision.isEnabled(), true,
                vision.getBaseUrl(), vision.getPath(), vision.getTimeout().toMillis()),
            new ProducerStatus(SignalSource.CLASSIFIER, classifier.isEnabled(), true,
                classifier.getBaseUrl(), classifier.getPath(), classifier.getTimeout().toMillis()));
    }

    public List<ProducerStatus> producers() {
        return producers;
    }

    /** True when decisions come from the remote classifier rather than the rule-based fallback. */
    public boolean classifierAuthoritative() {
        return producers.stream()
            .anyMatch(p -> p.source() == SignalSource.CLASSIFIER && p.enabled());
    }
}
