package com.decisionledger.evidence;

import com.decisionledger.signal.SignalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Best-effort, time-bounded access to the {@link EvidenceStore}.
 *
 * Writes run on a dedicated executor and are cancelled (interrupting the
 * writer) after the put timeout. A saturated executor rejects the write
 * immediately and the evidence is dropped. Store errors come back as a failed
 * {@link EvidenceWriteResult} instead of an exception.
 */
public class EvidenceSideband {

    private static final Logger log = LoggerFactory.getLogger(EvidenceSideband.class);

    private final EvidenceStore store;
    private final Executor executor;
    private final Duration putTimeout;

    public EvidenceSideband(EvidenceStore store, Executor executor, Duration putTimeout) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.executor = Objects.requireNonNull(executor, "executor is required");
        this.putTimeout = Objects.requireNonNull(putTimeout, "put timeout is required");
    }

    /** {@code evidence/<event_id>/<signal-source>.json} */
    public static String keyFor(String eventId, SignalSource source) {
        return "evidence/" + eventId + "/" + source.getValue() + ".json";
    }

    public EvidenceWriteResult put(String key, Map<String, Object> payload) {
        FutureTask<Void> write = new FutureTask<>(() -> store.put(key, payload), null);
        try {
            executor.execute(write);
        } catch (RejectedExecutionException ex) {
            log.warn("Evidence write {} rejected, writer pool saturated", key);
            return EvidenceWriteResult.failed(key, "writer pool saturated");
        }
        try {
            write.get(putTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return EvidenceWriteResult.stored(key);
        } catch (TimeoutException ex) {
            abandon(write);
            log.warn("Evidence write {} timed out after {} ms", key, putTimeout.toMillis());
            return EvidenceWriteResult.failed(key, "timed out after " + putTimeout.toMillis() + " ms");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.warn("Evidence write {} failed: {}", key, cause.getMessage());
            return EvidenceWriteResult.failed(key, cause.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            abandon(write);
            return EvidenceWriteResult.failed(key, "interrupted");
        }
    }

    private void abandon(FutureTask<Void> write) {
        write.cancel(true);
        if (executor instanceof ThreadPoolExecutor pool) {
            // drop cancelled writes still sitting in the queue
            pool.purge();
        }
    }

    public Optional<Map<String, Object>> get(String key) {
        try {
            return store.get(key);
        } catch (EvidenceStorageException ex) {
            log.warn("Evidence read {} failed: {}", key, ex.getMessage());
            return Optional.empty();
        }
    }
}
