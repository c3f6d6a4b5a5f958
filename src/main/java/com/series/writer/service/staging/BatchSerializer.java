package com.series.writer.service.staging;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.series.writer.service.model.TimeSeries;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Serializes a batch as a single JSON array of series objects.
 *
 * Non-finite sample values (staleness markers are NaN) are written as the strings
 * "NaN", "Infinity" and "-Infinity".
 */
@Component
public class BatchSerializer {

    private final ObjectWriter writer;

    public BatchSerializer(ObjectMapper objectMapper) {
        this.writer = objectMapper.writer()
                .with(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    public void write(List<TimeSeries> batch, OutputStream out) throws IOException {
        writer.writeValue(out, batch);
    }
}
