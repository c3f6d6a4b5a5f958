package com.series.writer.service.trigger;

import com.series.writer.service.buffer.IntakeBuffer;
import com.series.writer.service.config.WriterConfig;
import com.series.writer.service.ingest.IngestionException;
import com.series.writer.service.staging.StagingWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Size-threshold flush trigger, evaluated on the intake path after each enqueue.
 *
 * Several producers may cross the threshold at once; each one calls the staging
 * writer, and all but the first find an empty buffer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlushTrigger {

    private final IntakeBuffer buffer;
    private final StagingWriter stagingWriter;
    private final WriterConfig config;

    /**
     * Flushes if the buffer holds more than the configured maximum batch size.
     *
     * @return true if a flush was attempted
     */
    public boolean onRecordEnqueued() {
        int size = buffer.size();
        int maxBatchSize = config.getBatch().getMaxSize();
        if (size <= maxBatchSize) {
            return false;
        }

        log.debug("Buffer size {} exceeds max batch size {}, flushing", size, maxBatchSize);
        try {
            stagingWriter.flush();
        } catch (IngestionException e) {
            // already logged by the writer; the producer's records were accepted
            log.warn("Threshold flush failed [{}]: {}", e.getErrorCode(), e.getMessage());
        }
        return true;
    }
}
