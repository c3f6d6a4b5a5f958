package com.series.writer.service.pipeline;

import com.series.writer.service.config.WriterConfig;
import com.series.writer.service.ingest.IngestionWorker;
import com.series.writer.service.staging.StagingWriter;
import com.series.writer.service.trigger.IntervalFlushTask;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the background tasks of the pipeline: the interval flusher and the ingestion worker.
 *
 * Each task gets its own platform thread so retry backoff never occupies a request
 * thread. Shutdown fires the shared cancellation signal, waits for both tasks (an
 * upload in progress is allowed to finish) and then stages whatever is still buffered.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionPipeline {

    private final IntervalFlushTask intervalFlushTask;
    private final IngestionWorker ingestionWorker;
    private final StagingWriter stagingWriter;
    private final CancellationSignal cancellation;
    private final WriterConfig config;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile List<ExecutorService> executors = List.of();

    // ==================== Lifecycle ====================

    @PostConstruct
    void init() {
        if (config.getPipeline().isEnabled()) {
            start();
        } else {
            log.info("Pipeline background tasks disabled");
        }
    }

    /**
     * Starts both background tasks. Calling it again while running has no effect.
     *
     * @throws IllegalStateException if the pipeline was already shut down
     */
    public void start() {
        if (stopped.get() || cancellation.isCancelled()) {
            throw new IllegalStateException("Pipeline was shut down and cannot be restarted");
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }

        ExecutorService flusher = Executors.newSingleThreadExecutor(r -> createPlatformThread(r, "interval-flusher"));
        ExecutorService worker = Executors.newSingleThreadExecutor(r -> createPlatformThread(r, "ingestion-worker"));
        executors = List.of(flusher, worker);
        flusher.submit(intervalFlushTask);
        worker.submit(ingestionWorker);

        log.info("IngestionPipeline started");
    }

    /**
     * Cancels both background tasks and stages anything still buffered, also when the
     * tasks were never started. Calling it more than once has no effect.
     */
    @PreDestroy
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        running.set(false);
        cancellation.cancel();
        executors.forEach(this::shutdownExecutor);
        finalFlush();
        log.info("IngestionPipeline stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    // ==================== Helper Methods ====================

    private void finalFlush() {
        try {
            stagingWriter.flush().ifPresent(file ->
                    log.info("Staged {} buffered records to {} at shutdown; it will not be uploaded by this process",
                            file.recordCount(), file.path()));
        } catch (Exception e) {
            log.error("Final flush at shutdown failed", e);
        }
    }

    private Thread createPlatformThread(Runnable runnable, String name) {
        var thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }

    private void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.getPipeline().getShutdownTimeoutSeconds(), TimeUnit.SECONDS)) {
                log.warn("Forcing shutdown of pipeline task");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
