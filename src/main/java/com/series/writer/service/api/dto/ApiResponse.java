package com.series.writer.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Envelope for every response of the write endpoint and its error handler.
 *
 * Exactly one of {@code data} and {@code error} is present.
 *
 * @param <T> the payload type on success
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, ErrorInfo error, Instant timestamp) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null, Instant.now());
    }

    public static <T> ApiResponse<T> error(String code, String message) {
        return new ApiResponse<>(false, null, new ErrorInfo(code, message), Instant.now());
    }

    /**
     * Machine-readable code (e.g. {@code DECODE_ERROR}) plus a human-readable message.
     */
    public record ErrorInfo(String code, String message) {
    }
}
