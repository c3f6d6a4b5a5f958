package com.series.writer.service.ingest;

import com.series.writer.service.TestFixtures;
import com.series.writer.service.config.MetricsConfig;
import com.series.writer.service.config.WriterConfig;
import com.series.writer.service.pipeline.CancellationSignal;
import com.series.writer.service.sink.BulkLoader;
import com.series.writer.service.sink.RecordingBulkLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Retry state is per worker instance and process lifetime; every test builds a fresh worker.
 */
class IngestionWorkerTest {

    @TempDir
    Path stagingDir;

    private MetricsConfig metrics;
    private WriterConfig config;
    private DefaultStagingFileQueue fileQueue;
    private CountingIdempotencyCache idempotencyCache;
    private CancellationSignal cancellation;

    @BeforeEach
    void setUp() {
        metrics = TestFixtures.metrics();
        config = TestFixtures.writerConfig(stagingDir);
        fileQueue = new DefaultStagingFileQueue(metrics);
        idempotencyCache = new CountingIdempotencyCache(metrics);
        cancellation = new CancellationSignal();
    }

    @AfterEach
    void tearDown() {
        cancellation.cancel();
    }

    @Test
    @DisplayName("Two failures then success with max retries 3: three attempts, one id, file deleted")
    void succeedsOnThirdAttempt() throws Exception {
        StagedFile file = stage("a");
        RecordingBulkLoader loader = new RecordingBulkLoader(2);

        UploadOutcome outcome = newWorker(loader).process(file);

        assertThat(outcome.state()).isEqualTo(UploadState.SUCCEEDED);
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(loader.calls()).hasSize(3);
        assertThat(loader.calls()).extracting(RecordingBulkLoader.Call::correlationId)
                .containsOnly(outcome.correlationId());
        assertThat(Files.exists(file.path())).isFalse();
        assertThat(idempotencyCache.size()).isZero();
        assertThat(idempotencyCache.releases(file.path())).isEqualTo(1);
        assertThat(metrics.getUploadRetries().count()).isEqualTo(2.0);
        assertThat(metrics.getUploadsSucceeded().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Three failures with max retries 3: file abandoned on disk, id released once")
    void abandonsAfterMaxRetries() throws Exception {
        StagedFile file = stage("b");
        RecordingBulkLoader loader = RecordingBulkLoader.alwaysFailing();

        UploadOutcome outcome = newWorker(loader).process(file);

        assertThat(outcome.state()).isEqualTo(UploadState.PERMANENTLY_FAILED);
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(loader.calls()).hasSize(3);
        assertThat(loader.calls()).extracting(RecordingBulkLoader.Call::correlationId)
                .containsOnly(outcome.correlationId());
        assertThat(Files.exists(file.path())).isTrue();
        assertThat(idempotencyCache.size()).isZero();
        assertThat(idempotencyCache.releases(file.path())).isEqualTo(1);
        assertThat(metrics.getUploadsFailed().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("First-attempt success uploads the file content once")
    void succeedsFirstTime() throws Exception {
        StagedFile file = stage("c");
        RecordingBulkLoader loader = RecordingBulkLoader.alwaysSucceeding();

        UploadOutcome outcome = newWorker(loader).process(file);

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(loader.calls()).singleElement().satisfies(call -> {
            assertThat(call.content()).isEqualTo("[\"c\"]");
            assertThat(call.destination().table()).isEqualTo("TimeSeries");
        });
    }

    @Test
    @DisplayName("A missing file is treated as handled and its id is released")
    void missingFileReleasesId() {
        StagedFile file = new StagedFile(stagingDir.resolve("gone.json"), 1, Instant.now());
        RecordingBulkLoader loader = RecordingBulkLoader.alwaysSucceeding();

        UploadOutcome outcome = newWorker(loader).process(file);

        assertThat(outcome.state()).isEqualTo(UploadState.ALREADY_HANDLED);
        assertThat(outcome.attempts()).isZero();
        assertThat(loader.calls()).isEmpty();
        assertThat(idempotencyCache.size()).isZero();
        assertThat(idempotencyCache.releases(file.path())).isEqualTo(1);
        assertThat(metrics.getUploadsMissing().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A file removed between attempts ends the retries")
    void fileRemovedDuringRetries() throws Exception {
        StagedFile file = stage("d");
        AtomicInteger calls = new AtomicInteger();
        BulkLoader loader = (path, destination, id, delete) -> {
            calls.incrementAndGet();
            try {
                Files.delete(path);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
            throw new IngestionException("timeout", IngestionException.BULK_LOAD_FAILED);
        };

        UploadOutcome outcome = newWorker(loader).process(file);

        assertThat(outcome.state()).isEqualTo(UploadState.ALREADY_HANDLED);
        assertThat(calls).hasValue(1);
        assertThat(idempotencyCache.releases(file.path())).isEqualTo(1);
    }

    @Test
    @DisplayName("Shutdown during backoff stops retrying without waiting out the delay")
    void cancellationDuringBackoff() throws Exception {
        config.getUpload().setMsBetweenRetries(60_000);
        StagedFile file = stage("e");
        RecordingBulkLoader loader = RecordingBulkLoader.alwaysFailing();
        IngestionWorker worker = newWorker(loader);

        CompletableFuture<UploadOutcome> outcome = CompletableFuture.supplyAsync(() -> worker.process(file));
        await().atMost(Duration.ofSeconds(2)).until(() -> loader.calls().size() == 1);
        cancellation.cancel();

        UploadOutcome result = outcome.get(2, TimeUnit.SECONDS);
        assertThat(result.state()).isEqualTo(UploadState.CANCELLED);
        assertThat(Files.exists(file.path())).isTrue();
        assertThat(idempotencyCache.size()).isZero();
    }

    @Test
    @DisplayName("Files are uploaded in queue order, each with its own id")
    void uploadsInFifoOrder() throws Exception {
        RecordingBulkLoader loader = RecordingBulkLoader.alwaysSucceeding();
        List<StagedFile> files = List.of(stage("1"), stage("2"), stage("3"));
        files.forEach(fileQueue::enqueue);

        Thread thread = startLoop(newWorker(loader));
        await().atMost(Duration.ofSeconds(5)).until(() -> loader.calls().size() == 3);
        cancellation.cancel();
        thread.join(2_000);

        assertThat(loader.calls()).extracting(RecordingBulkLoader.Call::file)
                .containsExactly(files.get(0).path(), files.get(1).path(), files.get(2).path());
        assertThat(loader.calls()).extracting(RecordingBulkLoader.Call::correlationId)
                .doesNotHaveDuplicates();
        assertThat(thread.isAlive()).isFalse();
    }

    @Test
    @DisplayName("A permanently failed file does not block the next one")
    void continuesAfterPermanentFailure() throws Exception {
        StagedFile bad = stage("bad");
        StagedFile good = stage("good");
        BulkLoader loader = (path, destination, id, delete) -> {
            if (path.equals(bad.path())) {
                throw new IngestionException("schema mismatch", IngestionException.BULK_LOAD_FAILED);
            }
            return RecordingBulkLoader.alwaysSucceeding().ingest(path, destination, id, delete);
        };
        fileQueue.enqueue(bad);
        fileQueue.enqueue(good);

        Thread thread = startLoop(newWorker(loader));
        await().atMost(Duration.ofSeconds(5)).until(() -> !Files.exists(good.path()));
        cancellation.cancel();
        thread.join(2_000);

        assertThat(Files.exists(bad.path())).isTrue();
        assertThat(idempotencyCache.size()).isZero();
    }

    @Test
    @DisplayName("An idle worker stops promptly on cancellation")
    void idleWorkerStops() throws Exception {
        Thread thread = startLoop(newWorker(RecordingBulkLoader.alwaysSucceeding()));

        cancellation.cancel();
        thread.join(2_000);

        assertThat(thread.isAlive()).isFalse();
    }

    private Thread startLoop(IngestionWorker worker) {
        Thread thread = new Thread(worker, "ingestion-worker-test");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private IngestionWorker newWorker(BulkLoader loader) {
        return new IngestionWorker(fileQueue, idempotencyCache, loader, cancellation, metrics, config);
    }

    private StagedFile stage(String content) throws Exception {
        Path path = stagingDir.resolve("timeseries_" + content + ".json");
        Files.writeString(path, "[\"" + content + "\"]");
        return new StagedFile(path, 1, Instant.now());
    }

    /**
     * Counts how often each path's identifier is actually released.
     */
    static class CountingIdempotencyCache extends InMemoryIdempotencyCache {

        private final Map<Path, AtomicInteger> releases = new ConcurrentHashMap<>();

        CountingIdempotencyCache(MetricsConfig metricsConfig) {
            super(metricsConfig);
        }

        @Override
        public Optional<UUID> release(Path file) {
            Optional<UUID> released = super.release(file);
            released.ifPresent(id -> releases.computeIfAbsent(file, k -> new AtomicInteger()).incrementAndGet());
            return released;
        }

        int releases(Path file) {
            AtomicInteger count = releases.get(file);
            return count == null ? 0 : count.get();
        }
    }
}
