package com.decisionledger.evidence;

import com.decisionledger.signal.SignalSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceSidebandTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void key_followsEventAndSourceLayout() {
        assertEquals("evidence/evt-20260101-abcdefgh/vision.json",
            EvidenceSideband.keyFor("evt-20260101-abcdefgh", SignalSource.VISION));
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        void successfulWrite_isStored() {
            InMemoryEvidenceStore store = new InMemoryEvidenceStore();
            EvidenceSideband sideband = new EvidenceSideband(store, executor, Duration.ofSeconds(1));

            EvidenceWriteResult result = sideband.put("evidence/e/pattern.json", Map.of("k", "v"));

            assertTrue(result.stored());
            assertEquals(Optional.of(Map.of("k", "v")), sideband.get("evidence/e/pattern.json"));
        }

        @Test
        void hungStore_timesOutWithinBound() {
            CountDownLatch release = new CountDownLatch(1);
            EvidenceStore hung = new EvidenceStore() {
                @Override
                public void put(String key, Map<String, Object> payload) {
                    try {
                        release.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException ex) {
                        Thread.currentThread().interrupt();
                    }
                }

                @Override
                public Optional<Map<String, Object>> get(String key) {
                    return Optional.empty();
                }
            };
            EvidenceSideband sideband = new EvidenceSideband(hung, executor, Duration.ofMillis(100));

            long started = System.nanoTime();
            EvidenceWriteResult result = sideband.put("evidence/e/vision.json", Map.of());
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            release.countDown();

            assertFalse(result.stored());
            assertTrue(result.error().contains("timed out"));
            assertTrue(elapsedMs < 5_000, "caller must not wait for the hung store");
        }

        @Test
        void failingStore_isReportedNotThrown() {
            EvidenceStore failing = new EvidenceStore() {
                @Override
                public void put(String key, Map<String, Object> payload) {
                    throw new EvidenceStorageException("disk full");
                }

                @Override
                public Optional<Map<String, Object>> get(String key) {
                    throw new EvidenceStorageException("disk gone");
                }
            };
            EvidenceSideband sideband = new EvidenceSideband(failing, executor, Duration.ofSeconds(1));

            EvidenceWriteResult result = sideband.put("evidence/e/pattern.json", Map.of());

            assertFalse(result.stored());
            assertEquals("disk full", result.error());
            assertEquals(Optional.empty(), sideband.get("evidence/e/pattern.json"));
        }
    }

    @Nested
    @DisplayName("Bounded writer pool")
    class WriterPool {

        private final CountDownLatch release = new CountDownLatch(1);
        private final InMemoryEvidenceStore healthy = new InMemoryEvidenceStore();
        private ThreadPoolExecutor pool;

        @BeforeEach
        void setUp() {
            pool = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(1));
        }

        @AfterEach
        void tearDown() {
            release.countDown();
            pool.shutdownNow();
        }

        @Test
        void interruptibleHang_freesWriterForLaterWrites() {
            EvidenceStore store = storeHangingOn("evidence/hung/vision.json", false);
            EvidenceSideband sideband = new EvidenceSideband(store, pool, Duration.ofMillis(200));

            assertFalse(sideband.put("evidence/hung/vision.json", Map.of()).stored());

            int stored = 0;
            for (int i = 0; i < 20; i++) {
                if (sideband.put("evidence/evt-" + i + "/pattern.json", Map.of("i", i)).stored()) {
                    stored++;
                }
            }
            assertEquals(20, stored);
            assertEquals(20, healthy.keys().size());
        }

        @Test
        void stuckWriter_dropsQueuedWrites_andRejectsWhenSaturated() {
            EvidenceStore store = storeHangingOn("evidence/hung/vision.json", true);
            EvidenceSideband sideband = new EvidenceSideband(store, pool, Duration.ofMillis(100));

            assertFalse(sideband.put("evidence/hung/vision.json", Map.of()).stored());

            EvidenceWriteResult queued = sideband.put("evidence/evt-1/pattern.json", Map.of());
            assertFalse(queued.stored());
            assertTrue(pool.getQueue().isEmpty(), "timed-out write must not stay queued");

            pool.execute(() -> { });
            long started = System.nanoTime();
            EvidenceWriteResult rejected = sideband.put("evidence/evt-2/pattern.json", Map.of());
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertFalse(rejected.stored());
            assertEquals("writer pool saturated", rejected.error());
            assertTrue(elapsedMs < 100, "saturated pool must fail fast, took " + elapsedMs + " ms");
            assertEquals(1, pool.getQueue().size());
        }

        private EvidenceStore storeHangingOn(String hungKey, boolean ignoreInterrupts) {
            return new EvidenceStore() {
                @Override
                public void put(String key, Map<String, Object> payload) {
                    if (!key.equals(hungKey)) {
                        healthy.put(key, payload);
                        return;
                    }
                    boolean interrupted = false;
                    while (true) {
                        try {
                            release.await();
                            break;
                        } catch (InterruptedException ex) {
                            if (!ignoreInterrupts) {
                                Thread.currentThread().interrupt();
                                return;
                            }
                            interrupted = true;
                        }
                    }
                    if (interrupted) {
                        Thread.currentThread().interrupt();
                    }
                }

                @Override
                public Optional<Map<String, Object>> get(String key) {
                    return healthy.get(key);
                }
            };
        }
    }

    @Nested
    @DisplayName("File system store")
    class FileSystem {

        @TempDir
        Path root;

        @Test
        void writesJsonUnderKeyPath_andReadsBack() {
            FileSystemEvidenceStore store = new FileSystemEvidenceStore(root, new ObjectMapper());

            store.put("evidence/evt-1/pattern.json", Map.of("match_count", 2));

            assertTrue(Files.isRegularFile(root.resolve("evidence/evt-1/pattern.json")));
            assertEquals(Optional.of(Map.of("match_count", 2)), store.get("evidence/evt-1/pattern.json"));
            assertEquals(Optional.empty(), store.get("evidence/evt-2/pattern.json"));
        }

        @Test
        void keysEscapingRoot_areRejected() {
            FileSystemEvidenceStore store = new FileSystemEvidenceStore(root, new ObjectMapper());
            assertThrows(EvidenceStorageException.class, () -> store.put("../outside.json", Map.of()));
        }
    }
}
