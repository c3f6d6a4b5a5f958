package com.series.writer.service.ingest;

import com.series.writer.service.config.MetricsConfig;
import com.series.writer.service.config.WriterConfig;
import com.series.writer.service.pipeline.CancellationSignal;
import com.series.writer.service.sink.BulkLoader;
import com.series.writer.service.sink.DestinationDescriptor;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Worker that uploads staged files to the sink, one at a time, in queue order.
 *
 * Every attempt for a file presents the same correlation id. A failed attempt is
 * retried after a fixed delay until the retry budget is spent; the file is then
 * left on disk. The delay blocks only this worker's thread.
 */
@Slf4j
@Service
public class IngestionWorker implements Runnable {

    private final StagingFileQueue fileQueue;
    private final IdempotencyCache idempotencyCache;
    private final BulkLoader bulkLoader;
    private final CancellationSignal cancellation;
    private final MetricsConfig metricsConfig;
    private final WriterConfig.UploadConfig uploadConfig;
    private final DestinationDescriptor destination;

    public IngestionWorker(StagingFileQueue fileQueue,
                           IdempotencyCache idempotencyCache,
                           BulkLoader bulkLoader,
                           CancellationSignal cancellation,
                           MetricsConfig metricsConfig,
                           WriterConfig writerConfig) {
        this.fileQueue = fileQueue;
        this.idempotencyCache = idempotencyCache;
        this.bulkLoader = bulkLoader;
        this.cancellation = cancellation;
        this.metricsConfig = metricsConfig;
        this.uploadConfig = writerConfig.getUpload();
        this.destination = DestinationDescriptor.from(writerConfig.getSink());
    }

    // ==================== Processing Loop ====================

    @Override
    public void run() {
        log.info("IngestionWorker started, destination {}, max retries {}, {} ms between retries",
                destination, uploadConfig.getMaxRetries(), uploadConfig.getMsBetweenRetries());

        while (!cancellation.isCancelled()) {
            processNextFile();
        }

        log.info("IngestionWorker stopped, {} staging files left in queue", fileQueue.size());
    }

    private void processNextFile() {
        try {
            fileQueue.dequeue(uploadConfig.getPollMs())
                    .ifPresent(this::process);
        } catch (Exception e) {
            log.error("Error in ingestion worker loop", e);
        }
    }

    // ==================== Per-File State Machine ====================

    /**
     * Uploads one staged file to completion.
     *
     * @param file the staged file
     * @return the terminal outcome; the correlation id is released in every case
     */
    public UploadOutcome process(StagedFile file) {
        Path path = file.path();
        UUID correlationId = idempotencyCache.getOrCreate(path);
        UploadState state = UploadState.PENDING;
        int attempts = 0;

        try {
            while (!state.isTerminal()) {
                if (!Files.exists(path)) {
                    log.warn("Staging file {} does not exist, treating it as already handled", path);
                    metricsConfig.getUploadsMissing().increment();
                    state = UploadState.ALREADY_HANDLED;
                    continue;
                }

                attempts++;
                state = transition(path, state, UploadState.UPLOADING);
                try {
                    upload(path, correlationId, attempts);
                    state = transition(path, state, UploadState.SUCCEEDED);
                } catch (Exception e) {
                    state = onAttemptFailed(path, correlationId, attempts, e);
                }
            }
        } finally {
            idempotencyCache.release(path);
        }

        return new UploadOutcome(path, correlationId, state, attempts);
    }

    private void upload(Path path, UUID correlationId, int attempt) {
        log.info("Ingesting {} into {} with correlation id {} (attempt {})",
                path.getFileName(), destination, correlationId, attempt);

        Timer.Sample sample = Timer.start(metricsConfig.getRegistry());
        try {
            bulkLoader.ingest(path, destination, correlationId, true);
        } finally {
            sample.stop(metricsConfig.getUploadTimer());
        }

        metricsConfig.getUploadsSucceeded().increment();
        log.info("File {} ingested into {}", path.getFileName(), destination);
    }

    private UploadState onAttemptFailed(Path path, UUID correlationId, int attempts, Exception e) {
        int maxRetries = uploadConfig.getMaxRetries();

        if (attempts >= maxRetries) {
            metricsConfig.getUploadsFailed().increment();
            log.error("Permanently failed to ingest {} into {} after {} attempts, correlation id {}. "
                            + "File left on disk for manual recovery",
                    path, destination, attempts, correlationId, e);
            return transition(path, UploadState.UPLOADING, UploadState.PERMANENTLY_FAILED);
        }

        metricsConfig.getUploadRetries().increment();
        log.warn("Could not ingest {} (attempt {}/{}), retrying in {} ms: {}",
                path.getFileName(), attempts, maxRetries, uploadConfig.getMsBetweenRetries(), e.getMessage());
        log.debug("Attempt failure for correlation id {}", correlationId, e);
        transition(path, UploadState.UPLOADING, UploadState.RETRYING);

        if (cancellation.awaitCancellation(uploadConfig.getMsBetweenRetries())) {
            log.warn("Shutdown during retry backoff, leaving {} on disk", path);
            return transition(path, UploadState.RETRYING, UploadState.CANCELLED);
        }
        return UploadState.RETRYING;
    }

    private UploadState transition(Path path, UploadState from, UploadState to) {
        log.debug("{}: {} -> {}", path.getFileName(), from, to);
        return to;
    }
}
