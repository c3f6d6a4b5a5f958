package com.series.writer.service.intake;

import com.series.writer.service.buffer.IntakeBuffer;
import com.series.writer.service.config.MetricsConfig;
import com.series.writer.service.model.TimeSeries;
import com.series.writer.service.trigger.FlushTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Single intake entry point for decoded time series.
 *
 * Enqueues records in payload order and consults the threshold trigger after each one.
 * Returning means the records are buffered in memory, not that they are staged or uploaded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeriesIntakeService {

    private final IntakeBuffer buffer;
    private final FlushTrigger flushTrigger;
    private final MetricsConfig metricsConfig;

    /**
     * Buffers the given records.
     *
     * @param series decoded records, in payload order
     * @return number of records accepted
     */
    public int accept(List<TimeSeries> series) {
        for (TimeSeries record : series) {
            buffer.enqueue(record);
            flushTrigger.onRecordEnqueued();
        }
        metricsConfig.getRecordsReceived().increment(series.size());
        log.debug("Accepted {} series, buffer size now {}", series.size(), buffer.size());
        return series.size();
    }

    /**
     * Gets the number of records currently waiting in the intake buffer.
     */
    public int bufferedRecords() {
        return buffer.size();
    }
}
