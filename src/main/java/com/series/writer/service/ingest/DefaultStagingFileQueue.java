package com.series.writer.service.ingest;

import com.series.writer.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of StagingFileQueue using an unbounded FIFO BlockingQueue.
 *
 * Staging files are already durable on disk, so the queue never applies
 * backpressure to the staging writer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultStagingFileQueue implements StagingFileQueue {

    private final MetricsConfig metricsConfig;

    private final BlockingQueue<StagedFile> queue = new LinkedBlockingQueue<>();

    @PostConstruct
    void init() {
        metricsConfig.registerQueueGauge(
                "series.ingest.queue.size",
                "Number of staging files waiting to be uploaded",
                this::size
        );
        log.info("StagingFileQueue initialized");
    }

    @Override
    public void enqueue(StagedFile file) {
        queue.add(file);
        log.debug("Enqueued staging file: {} ({} records)", file.fileName(), file.recordCount());
    }

    @Override
    public Optional<StagedFile> dequeue(long timeoutMs) {
        try {
            StagedFile file = queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
            if (file != null) {
                log.debug("Dequeued staging file: {}", file.fileName());
            }
            return Optional.ofNullable(file);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for staging files");
            return Optional.empty();
        }
    }

    @Override
    public int size() {
        return queue.size();
    }
}
