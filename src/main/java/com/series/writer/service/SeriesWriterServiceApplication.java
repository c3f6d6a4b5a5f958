package com.series.writer.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Series Writer Service Application - Entry point for the Spring Boot application.
 *
 * Accepts Prometheus remote-write traffic and moves it to a columnar analytics sink:
 * - Buffers decoded time series in memory
 * - Stages buffered batches to JSON files (size threshold or interval)
 * - Uploads staged files through the bulk loader with bounded, idempotent retries
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.series.writer.service.config")
public class SeriesWriterServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SeriesWriterServiceApplication.class, args);
    }
}
