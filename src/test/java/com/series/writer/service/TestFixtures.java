package com.series.writer.service;

import com.series.writer.service.config.MetricsConfig;
import com.series.writer.service.config.WriterConfig;
import com.series.writer.service.model.Label;
import com.series.writer.service.model.Sample;
import com.series.writer.service.model.TimeSeries;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.util.List;

/**
 * Builders shared by unit tests that wire pipeline components by hand.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    public static TimeSeries series(String metric, double value, long timestamp) {
        return new TimeSeries(
                List.of(new Label("__name__", metric), new Label("job", "test")),
                List.of(new Sample(value, timestamp))
        );
    }

    public static TimeSeries series(int index) {
        return series("metric_" + index, index, 1_700_000_000_000L + index);
    }

    public static String metricName(TimeSeries series) {
        return series.labels().stream()
                .filter(label -> "__name__".equals(label.name()))
                .map(Label::value)
                .findFirst()
                .orElse(null);
    }

    public static MetricsConfig metrics() {
        return new MetricsConfig(new SimpleMeterRegistry());
    }

    public static WriterConfig writerConfig(Path stagingDirectory) {
        WriterConfig config = new WriterConfig();
        config.getStaging().setDirectory(stagingDirectory.toString());
        config.getBatch().setMaxSize(100);
        config.getBatch().setMaxIntervalSeconds(1);
        config.getUpload().setMaxRetries(3);
        config.getUpload().setMsBetweenRetries(10);
        config.getUpload().setPollMs(20);
        config.getPipeline().setShutdownTimeoutSeconds(5);
        return config;
    }
}
