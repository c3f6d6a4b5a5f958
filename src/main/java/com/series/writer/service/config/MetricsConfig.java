package com.series.writer.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for Series Writer Service.
 *
 * Provides custom metrics for intake, staging and upload operations.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter recordsReceived;
    private final Counter filesStaged;
    private final Counter recordsStaged;
    private final Counter stagingFailures;
    private final Counter uploadsSucceeded;
    private final Counter uploadRetries;
    private final Counter uploadsFailed;
    private final Counter uploadsMissing;

    // Timers
    private final Timer stagingTimer;
    private final Timer uploadTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.recordsReceived = Counter.builder("series.intake.records")
                .description("Number of time series records accepted at intake")
                .register(registry);

        this.filesStaged = Counter.builder("series.staging.files")
                .description("Number of staging files written")
                .register(registry);

        this.recordsStaged = Counter.builder("series.staging.records")
                .description("Number of time series records written to staging files")
                .register(registry);

        this.stagingFailures = Counter.builder("series.staging.failures")
                .description("Number of batches lost to serialization or write errors")
                .register(registry);

        this.uploadsSucceeded = Counter.builder("series.upload.success")
                .description("Number of staging files ingested by the sink")
                .register(registry);

        this.uploadRetries = Counter.builder("series.upload.retries")
                .description("Number of failed upload attempts that were retried")
                .register(registry);

        this.uploadsFailed = Counter.builder("series.upload.failures")
                .description("Number of staging files abandoned after exhausting retries")
                .register(registry);

        this.uploadsMissing = Counter.builder("series.upload.missing")
                .description("Number of staging files that no longer existed at upload time")
                .register(registry);

        this.stagingTimer = Timer.builder("series.staging.duration")
                .description("Time taken to drain, serialize and write a batch")
                .register(registry);

        this.uploadTimer = Timer.builder("series.upload.duration")
                .description("Time taken for a single upload attempt")
                .register(registry);
    }

    /**
     * Registers a gauge for queue depth monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerQueueGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
