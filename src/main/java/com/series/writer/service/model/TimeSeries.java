package com.series.writer.service.model;

import java.util.List;

/**
 * An immutable labeled sequence of samples, as received from a metrics agent.
 *
 * The pipeline treats a series as an opaque value: it is buffered, staged and
 * uploaded exactly as decoded, without reordering or deduplicating samples.
 */
public record TimeSeries(List<Label> labels, List<Sample> samples) {

    public TimeSeries {
        labels = labels == null ? List.of() : List.copyOf(labels);
        samples = samples == null ? List.of() : List.copyOf(samples);
    }
}
