package com.decisionledger.signal;

import com.decisionledger.policy.PolicyPack;

import java.time.Duration;

/**
 * A black-box risk detector.
 *
 * Implementations must not throw: errors and timeouts are reported as
 * {@link SignalOutcome.Failed}, an empty result as {@link SignalOutcome.NoSignal}.
 */
public interface SignalProducer {

    SignalSource source();

    /**
     * @param input the content under evaluation
     * @param activePack the policy pack active for this evaluation (may be null)
     * @param timeout upper bound for any call that leaves the process
     */
    SignalOutcome produce(EvaluationInput input, PolicyPack activePack, Duration timeout);
}
