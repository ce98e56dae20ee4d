package com.decisionledger.signal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of a single producer call. Producers report errors as values,
 * never as exceptions crossing into the merge engine.
 */
public sealed interface SignalOutcome {

    SignalSource source();

    /** The producer emitted a signal. */
    record Produced(EvaluationSignal signal) implements SignalOutcome {
        public Produced {
            Objects.requireNonNull(signal, "signal is required");
        }

        @Override
        public SignalSource source() {
            return signal.source();
        }
    }

    /** The producer ran (or was skipped for lack of input) and found nothing. */
    record NoSignal(SignalSource source, Map<String, Object> evidence) implements SignalOutcome {
        public NoSignal {
            Objects.requireNonNull(source, "source is required");
            evidence = evidence == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
        }
    }

    /** The producer errored or timed out. */
    record Failed(SignalSource source, String reason) implements SignalOutcome {
        public Failed {
            Objects.requireNonNull(source, "source is required");
            reason = reason == null || reason.isBlank() ? "unknown error" : reason;
        }
    }

    static SignalOutcome produced(EvaluationSignal signal) {
        return new Produced(signal);
    }

    static SignalOutcome none(SignalSource source) {
        return new NoSignal(source, Map.of());
    }

    static SignalOutcome failed(SignalSource source, String reason) {
        return new Failed(source, reason);
    }
}
