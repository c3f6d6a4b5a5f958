package com.series.writer.service.model;

/**
 * A timestamped sample value. Timestamp is in epoch milliseconds.
 */
public record Sample(double value, long timestamp) {
}
