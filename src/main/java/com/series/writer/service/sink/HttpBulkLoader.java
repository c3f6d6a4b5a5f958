package com.series.writer.service.sink;

import com.series.writer.service.config.WriterConfig;
import com.series.writer.service.ingest.IngestionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * BulkLoader that streams staging files to the sink's bulk ingest endpoint over HTTP.
 *
 * The correlation id travels in the {@value #CORRELATION_HEADER} header; the sink
 * uses it to discard repeated submissions of a file it already loaded.
 */
@Slf4j
@Component
public class HttpBulkLoader implements BulkLoader {

    public static final String CORRELATION_HEADER = "X-Correlation-Id";

    private final RestTemplate restTemplate;
    private final WriterConfig.SinkConfig sinkConfig;

    public HttpBulkLoader(RestTemplate sinkRestTemplate, WriterConfig writerConfig) {
        this.restTemplate = sinkRestTemplate;
        this.sinkConfig = writerConfig.getSink();
    }

    @Override
    public LoadResult ingest(Path file, DestinationDescriptor destination, UUID correlationId,
                             boolean deleteSourceOnSuccess) {
        String fileName = file.getFileName().toString();
        long bytes = sizeOf(file, correlationId);

        ResponseEntity<String> response;
        try {
            response = restTemplate.exchange(
                    buildUri(destination),
                    HttpMethod.POST,
                    new HttpEntity<>(new FileSystemResource(file), buildHeaders(correlationId)),
                    String.class
            );
        } catch (RestClientException e) {
            throw new IngestionException(
                    "Bulk load of " + fileName + " into " + destination + " failed: " + e.getMessage(),
                    correlationId.toString(),
                    IngestionException.BULK_LOAD_FAILED,
                    e
            );
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new IngestionException(
                    "Bulk load of " + fileName + " rejected with HTTP " + response.getStatusCode().value(),
                    correlationId.toString(),
                    IngestionException.BULK_LOAD_FAILED,
                    null
            );
        }

        boolean deleted = deleteSourceOnSuccess && deleteSource(file);
        log.debug("Sink accepted {} ({} bytes) with correlation id {}", fileName, bytes, correlationId);
        return new LoadResult(correlationId, fileName, bytes, response.getStatusCode().value(), deleted);
    }

    // ==================== Private Methods ====================

    private URI buildUri(DestinationDescriptor destination) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(sinkConfig.getEndpoint())
                .queryParam("database", destination.database())
                .queryParam("table", destination.table())
                .queryParam("format", destination.format());
        if (destination.hasMapping()) {
            builder.queryParam("mappingName", destination.mappingName());
        }
        return builder.encode().build().toUri();
    }

    private HttpHeaders buildHeaders(UUID correlationId) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(CORRELATION_HEADER, correlationId.toString());
        String token = sinkConfig.getAccessToken();
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
        }
        return headers;
    }

    private long sizeOf(Path file, UUID correlationId) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new IngestionException(
                    "Cannot read staging file " + file + ": " + e.getMessage(),
                    correlationId.toString(),
                    IngestionException.BULK_LOAD_FAILED,
                    e
            );
        }
    }

    private boolean deleteSource(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            // the load itself succeeded; a leftover file only costs disk space
            log.warn("Loaded {} but could not delete it: {}", file, e.getMessage());
            return false;
        }
    }
}
