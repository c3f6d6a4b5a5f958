package com.series.writer.service.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the batching and ingestion pipeline.
 *
 * Controls batch thresholds, the staging directory, upload retries and the sink destination.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "series.writer")
public class WriterConfig {

    /**
     * Intake request limits.
     */
    @Valid
    private IntakeConfig intake = new IntakeConfig();

    /**
     * Batching thresholds.
     */
    @Valid
    private BatchConfig batch = new BatchConfig();

    /**
     * Staging file settings.
     */
    @Valid
    private StagingConfig staging = new StagingConfig();

    /**
     * Upload retry settings.
     */
    @Valid
    private UploadConfig upload = new UploadConfig();

    /**
     * Bulk loader destination.
     */
    @Valid
    private SinkConfig sink = new SinkConfig();

    /**
     * Background task settings.
     */
    private PipelineConfig pipeline = new PipelineConfig();

    @Getter
    @Setter
    public static class IntakeConfig {

        /**
         * Largest uncompressed remote-write body accepted, in bytes.
         */
        @Min(1)
        private int maxDecompressedBytes = 32 * 1024 * 1024;
    }

    @Getter
    @Setter
    public static class BatchConfig {

        /**
         * Buffered record count above which a producer triggers a flush.
         */
        @Min(1)
        private int maxSize = 10000;

        /**
         * Interval between background flush checks, in seconds.
         */
        @Min(1)
        private long maxIntervalSeconds = 30;
    }

    @Getter
    @Setter
    public static class StagingConfig {

        /**
         * Directory staging files are written to.
         */
        @NotBlank
        private String directory = System.getProperty("java.io.tmpdir") + "/series-writer";

        /**
         * Staging file name prefix.
         */
        @NotBlank
        private String filePrefix = "timeseries";
    }

    @Getter
    @Setter
    public static class UploadConfig {

        /**
         * Number of upload attempts per staging file before it is abandoned.
         */
        @Min(1)
        private int maxRetries = 3;

        /**
         * Fixed delay between upload attempts, in milliseconds.
         */
        @Min(0)
        private long msBetweenRetries = 1000;

        /**
         * How long the worker waits on an empty queue before re-checking for shutdown.
         */
        @Min(1)
        private long pollMs = 500;
    }

    @Getter
    @Setter
    public static class SinkConfig {

        /**
         * Bulk ingest endpoint of the analytics sink.
         */
        @NotBlank
        private String endpoint = "http://localhost:8081/v1/rest/ingest";

        @NotBlank
        private String database = "metrics";

        @NotBlank
        private String table = "TimeSeries";

        /**
         * Optional ingestion mapping reference on the sink side.
         */
        private String mappingName = "";

        @NotBlank
        private String format = "multijson";

        /**
         * Optional bearer token sent with every upload.
         */
        private String accessToken = "";

        private int connectTimeoutMs = 5000;

        private int readTimeoutMs = 60000;
    }

    @Getter
    @Setter
    public static class PipelineConfig {

        /**
         * Start the interval flusher and ingestion worker at startup.
         */
        private boolean enabled = true;

        /**
         * Bounded wait for background threads on shutdown, in seconds.
         */
        private long shutdownTimeoutSeconds = 30;
    }
}
