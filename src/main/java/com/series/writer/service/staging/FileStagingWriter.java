package com.series.writer.service.staging;

import com.series.writer.service.buffer.IntakeBuffer;
import com.series.writer.service.config.MetricsConfig;
import com.series.writer.service.ingest.IngestionException;
import com.series.writer.service.ingest.StagedFile;
import com.series.writer.service.ingest.StagingFileQueue;
import com.series.writer.service.model.TimeSeries;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Staging writer backed by the local filesystem.
 *
 * Drain, serialize, write and publish all happen under one lock, so concurrent
 * triggers never merge two drains into one file or stage overlapping drains.
 * Files are written to a temporary sibling and renamed into place before their
 * path reaches the ingestion queue.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileStagingWriter implements StagingWriter {

    private final IntakeBuffer buffer;
    private final StagingFileQueue fileQueue;
    private final BatchSerializer serializer;
    private final StagingFileNamer namer;
    private final MetricsConfig metricsConfig;

    private final Lock lock = new ReentrantLock();

    @PostConstruct
    void init() {
        try {
            Files.createDirectories(namer.directory());
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create staging directory " + namer.directory(), e);
        }
        log.info("Staging files will be written to {}", namer.directory());
    }

    @Override
    public Optional<StagedFile> flush() {
        lock.lock();
        try {
            List<TimeSeries> batch = buffer.drainAll();
            if (batch.isEmpty()) {
                log.debug("Flush requested on empty buffer, nothing to stage");
                return Optional.empty();
            }
            return Optional.of(stage(batch));
        } finally {
            lock.unlock();
        }
    }

    // ==================== Private Methods ====================

    private StagedFile stage(List<TimeSeries> batch) {
        Instant drainedAt = Instant.now();
        Path target = namer.next(drainedAt);
        Timer.Sample sample = Timer.start(metricsConfig.getRegistry());

        try {
            writeAtomically(target, batch);
        } catch (IOException | RuntimeException e) {
            metricsConfig.getStagingFailures().increment();
            log.error("Failed to stage batch of {} records to {}, records are lost", batch.size(), target, e);
            throw new IngestionException(
                    "Failed to stage batch of " + batch.size() + " records: " + e.getMessage(),
                    target.toString(),
                    IngestionException.STAGING_FAILED,
                    e
            );
        } finally {
            sample.stop(metricsConfig.getStagingTimer());
        }

        StagedFile staged = new StagedFile(target, batch.size(), drainedAt);
        fileQueue.enqueue(staged);

        metricsConfig.getFilesStaged().increment();
        metricsConfig.getRecordsStaged().increment(batch.size());
        log.info("Staged {} records to {}", batch.size(), staged.fileName());
        return staged;
    }

    private void writeAtomically(Path target, List<TimeSeries> batch) throws IOException {
        Path temp = StagingFileNamer.tempPathFor(target);
        Files.createDirectories(target.getParent());
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                serializer.write(batch, out);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }
}
