package com.decisionledger.signal;

import com.decisionledger.policy.PolicyPack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Calls every registered producer once and gathers their outcomes in
 * registration order. An exception escaping a producer is downgraded to a
 * {@link SignalOutcome.Failed} so the merge never sees it.
 */
public class SignalCollector {

    private static final Logger log = LoggerFactory.getLogger(SignalCollector.class);

    private final List<SignalProducer> producers;
    private final Duration defaultTimeout;
    private final Map<SignalSource, Duration> timeouts;

    public SignalCollector(List<SignalProducer> producers,
                           Duration defaultTimeout,
                           Map<SignalSource, Duration> timeouts) {
        this.producers = List.copyOf(producers);
        this.defaultTimeout = defaultTimeout;
        this.timeouts = timeouts.isEmpty() ? new EnumMap<>(SignalSource.class) : new EnumMap<>(timeouts);
    }

    public List<SignalOutcome> collect(EvaluationInput input, PolicyPack activePack) {
        List<SignalOutcome> outcomes = new ArrayList<>(producers.size());
        for (SignalProducer producer : producers) {
            SignalOutcome outcome = invoke(producer, input, activePack);
            if (outcome instanceof SignalOutcome.Failed failed) {
                log.warn("Signal producer {} failed, continuing without it: {}",
                    failed.source().getValue(), failed.reason());
            }
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private SignalOutcome invoke(SignalProducer producer, EvaluationInput input, PolicyPack activePack) {
        Duration timeout = timeouts.getOrDefault(producer.source(), defaultTimeout);
        try {
            SignalOutcome outcome = producer.produce(input, activePack, timeout);
            if (outcome == null) {
                return SignalOutcome.none(producer.source());
            }
            return outcome;
        } catch (RuntimeException ex) {
            return SignalOutcome.failed(producer.source(),
                ex.getClass().getSimpleName() + ": " + ex.getMessage());
        }
    }
}
