package com.series.writer.service.api.health;

import com.series.writer.service.buffer.IntakeBuffer;
import com.series.writer.service.config.WriterConfig;
import com.series.writer.service.ingest.IdempotencyCache;
import com.series.writer.service.ingest.StagingFileQueue;
import com.series.writer.service.pipeline.IngestionPipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the batching pipeline.
 *
 * Reports buffer depth, pending staging files and in-flight uploads.
 */
@Component
@RequiredArgsConstructor
public class PipelineHealthIndicator implements HealthIndicator {

    private final IngestionPipeline pipeline;
    private final IntakeBuffer buffer;
    private final StagingFileQueue fileQueue;
    private final IdempotencyCache idempotencyCache;
    private final WriterConfig config;

    @Override
    public Health health() {
        boolean expectedRunning = config.getPipeline().isEnabled();
        Health.Builder builder = !expectedRunning || pipeline.isRunning()
                ? Health.up()
                : Health.down();

        return builder
                .withDetail("running", pipeline.isRunning())
                .withDetail("bufferedRecords", buffer.size())
                .withDetail("maxBatchSize", config.getBatch().getMaxSize())
                .withDetail("pendingFiles", fileQueue.size())
                .withDetail("inFlightUploads", idempotencyCache.size())
                .build();
    }
}
