package com.series.writer.service.model;

/**
 * A single name/value label of a time series.
 */
public record Label(String name, String value) {
}
