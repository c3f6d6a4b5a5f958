package com.series.writer.service.buffer;

import com.series.writer.service.config.MetricsConfig;
import com.series.writer.service.model.TimeSeries;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lock-free implementation of IntakeBuffer.
 *
 * Records live in a ConcurrentLinkedQueue; a separate counter tracks how many
 * enqueues have completed. A drain removes at most that many records, so a
 * drain always terminates even under a sustained stream of producers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConcurrentIntakeBuffer implements IntakeBuffer {

    private final MetricsConfig metricsConfig;

    private final Queue<TimeSeries> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger count = new AtomicInteger();

    @PostConstruct
    void init() {
        metricsConfig.registerQueueGauge(
                "series.buffer.size",
                "Number of time series records waiting to be staged",
                this::size
        );
        log.info("IntakeBuffer initialized");
    }

    @Override
    public void enqueue(TimeSeries series) {
        queue.offer(series);
        // counted only after it is visible in the queue
        count.incrementAndGet();
    }

    @Override
    public int size() {
        return count.get();
    }

    @Override
    public List<TimeSeries> drainAll() {
        int limit = count.get();
        if (limit == 0) {
            return Collections.emptyList();
        }

        List<TimeSeries> batch = new ArrayList<>(limit);
        TimeSeries next;
        while (batch.size() < limit && (next = queue.poll()) != null) {
            batch.add(next);
        }
        count.addAndGet(-batch.size());

        log.debug("Drained {} records from intake buffer", batch.size());
        return Collections.unmodifiableList(batch);
    }
}
