package com.series.writer.service.trigger;

import com.series.writer.service.buffer.IntakeBuffer;
import com.series.writer.service.config.WriterConfig;
import com.series.writer.service.pipeline.CancellationSignal;
import com.series.writer.service.staging.StagingWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Background loop that flushes whatever is buffered every max batch interval.
 *
 * Bounds how long a record can wait when producers are slow.
 * Runs until the cancellation signal fires.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntervalFlushTask implements Runnable {

    private final IntakeBuffer buffer;
    private final StagingWriter stagingWriter;
    private final WriterConfig config;
    private final CancellationSignal cancellation;

    @Override
    public void run() {
        long intervalMs = TimeUnit.SECONDS.toMillis(config.getBatch().getMaxIntervalSeconds());
        log.info("Interval flusher started, interval {} ms", intervalMs);

        while (!cancellation.awaitCancellation(intervalMs)) {
            flushIfPending();
        }

        log.info("Interval flusher stopped");
    }

    void flushIfPending() {
        int size = buffer.size();
        if (size == 0) {
            return;
        }
        log.debug("Max batch interval reached, flushing {} buffered records", size);
        try {
            stagingWriter.flush();
        } catch (Exception e) {
            log.error("Interval flush failed", e);
        }
    }
}
