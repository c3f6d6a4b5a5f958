package com.series.writer.service.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client configuration for the bulk loader.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class SinkClientConfig {

    private final WriterConfig writerConfig;

    @Bean
    public RestTemplate sinkRestTemplate(RestTemplateBuilder builder) {
        WriterConfig.SinkConfig sink = writerConfig.getSink();
        log.info("Initializing sink client for {} (database={}, table={})",
                sink.getEndpoint(), sink.getDatabase(), sink.getTable());
        return builder
                .setConnectTimeout(Duration.ofMillis(sink.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(sink.getReadTimeoutMs()))
                .build();
    }
}
