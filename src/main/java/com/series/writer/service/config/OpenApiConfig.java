package com.series.writer.service.config;

import com.series.writer.service.ingest.IngestionException;
import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI document for the remote-write receiver.
 *
 * Describes the batching and sink settings in effect and publishes the shared
 * {@value #DECODE_ERROR_RESPONSE} response referenced by {@code POST /write}.
 */
@Configuration
public class OpenApiConfig {

    public static final String DECODE_ERROR_RESPONSE = "DecodeError";

    @Bean
    public OpenAPI seriesWriterOpenApi(WriterConfig config) {
        String description = String.format(
                "Prometheus remote-write receiver. Series are buffered until %d are pending or %d s pass, "
                        + "staged as %s files and bulk loaded into %s.%s. Bodies over %d uncompressed bytes "
                        + "are rejected.",
                config.getBatch().getMaxSize(),
                config.getBatch().getMaxIntervalSeconds(),
                config.getSink().getFormat(),
                config.getSink().getDatabase(),
                config.getSink().getTable(),
                config.getIntake().getMaxDecompressedBytes());

        return new OpenAPI()
                .info(new Info()
                        .title("Series Writer Service API")
                        .description(description)
                        .version("1.0.0"))
                .externalDocs(new ExternalDocumentation()
                        .description("Prometheus remote-write protocol")
                        .url("https://prometheus.io/docs/concepts/remote_write_spec/"))
                .components(new Components()
                        .addResponses(DECODE_ERROR_RESPONSE, decodeErrorResponse()));
    }

    private ApiResponse decodeErrorResponse() {
        Map<String, Object> example = Map.of(
                "success", false,
                "error", Map.of(
                        "code", IngestionException.DECODE_ERROR,
                        "message", "Invalid snappy payload"),
                "timestamp", "2024-01-01T00:00:00Z");

        return new ApiResponse()
                .description("Body is empty, not snappy-compressed, larger than the configured limit "
                        + "or not a prometheus.WriteRequest. Nothing is buffered.")
                .content(new Content().addMediaType("application/json", new MediaType().example(example)));
    }
}
