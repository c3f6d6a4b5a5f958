package com.series.writer.service.sink;

import com.series.writer.service.config.WriterConfig;

/**
 * Where and how the sink should load a staging file.
 *
 * @param database    target database
 * @param table       target table
 * @param mappingName ingestion mapping reference, blank for none
 * @param format      data format of the staging file
 */
public record DestinationDescriptor(String database, String table, String mappingName, String format) {

    public static DestinationDescriptor from(WriterConfig.SinkConfig sink) {
        return new DestinationDescriptor(sink.getDatabase(), sink.getTable(), sink.getMappingName(), sink.getFormat());
    }

    public boolean hasMapping() {
        return mappingName != null && !mappingName.isBlank();
    }

    @Override
    public String toString() {
        return database + "." + table;
    }
}
