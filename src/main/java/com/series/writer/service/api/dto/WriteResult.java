package com.series.writer.service.api.dto;

/**
 * Result of one remote-write request.
 *
 * @param acceptedSeries  series decoded from the request and buffered
 * @param bufferedRecords records waiting in the intake buffer once the request was handled
 */
public record WriteResult(int acceptedSeries, int bufferedRecords) {
}
