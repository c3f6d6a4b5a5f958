package com.series.writer.service.buffer;

import com.series.writer.service.model.TimeSeries;

import java.util.List;

/**
 * Interface for the intake buffer.
 *
 * Concurrent append-only holding area for decoded time series waiting to be staged.
 * Producers never block; a single drain removes everything queued at that moment.
 */
public interface IntakeBuffer {

    /**
     * Appends a record. Never blocks and never fails.
     *
     * @param series the record to buffer
     */
    void enqueue(TimeSeries series);

    /**
     * Gets the approximate number of buffered records.
     *
     * @return current buffer size
     */
    int size();

    /**
     * Removes and returns all currently buffered records in enqueue order.
     *
     * Every record is returned by exactly one drain. A record whose enqueue races
     * with a drain is returned by that drain or by the next one.
     *
     * @return the drained batch, empty if nothing was buffered
     */
    List<TimeSeries> drainAll();
}
