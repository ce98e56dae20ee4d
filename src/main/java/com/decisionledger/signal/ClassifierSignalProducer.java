package com.decisionledger.signal;

/**
 * Capability interface for the external classifier. Its signal, when
 * produced, is authoritative over rule-based signals.
 */
public interface ClassifierSignalProducer extends SignalProducer {

    @Override
    default SignalSource source() {
        return SignalSource.CLASSIFIER;
    }

    /** Whether the classifier is configured to be called at all. */
    boolean isEnabled();
}
