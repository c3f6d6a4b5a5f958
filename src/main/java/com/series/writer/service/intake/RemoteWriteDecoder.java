package com.series.writer.service.intake;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import com.series.writer.service.config.WriterConfig;
import com.series.writer.service.ingest.IngestionException;
import com.series.writer.service.model.Label;
import com.series.writer.service.model.Sample;
import com.series.writer.service.model.TimeSeries;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.xerial.snappy.Snappy;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes Prometheus remote-write bodies: snappy block compression around a
 * protobuf {@code prometheus.WriteRequest}.
 *
 * Only series labels and float samples are read. Metadata, exemplars and native
 * histograms are skipped. The uncompressed size declared in the snappy header is
 * checked against {@code series.writer.intake.max-decompressed-bytes} before anything
 * is allocated.
 */
@Component
@RequiredArgsConstructor
public class RemoteWriteDecoder {

    // prometheus.WriteRequest
    private static final int WRITE_REQUEST_TIMESERIES = 1;
    // prometheus.TimeSeries
    private static final int TIMESERIES_LABELS = 1;
    private static final int TIMESERIES_SAMPLES = 2;
    // prometheus.Label
    private static final int LABEL_NAME = 1;
    private static final int LABEL_VALUE = 2;
    // prometheus.Sample
    private static final int SAMPLE_VALUE = 1;
    private static final int SAMPLE_TIMESTAMP = 2;

    private final WriterConfig config;

    /**
     * Decodes a compressed remote-write body.
     *
     * @param body the raw request body
     * @return the series in payload order
     * @throws IngestionException with code DECODE_ERROR if the body is not a valid write request
     */
    public List<TimeSeries> decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new IngestionException("Empty remote-write body", IngestionException.DECODE_ERROR);
        }

        byte[] raw = uncompress(body);

        try {
            return readWriteRequest(CodedInputStream.newInstance(raw));
        } catch (IOException e) {
            throw new IngestionException("Invalid remote-write protobuf: " + e.getMessage(),
                    IngestionException.DECODE_ERROR, e);
        }
    }

    private byte[] uncompress(byte[] body) {
        int maxBytes = config.getIntake().getMaxDecompressedBytes();
        try {
            // uncompressedLength only parses the varint header; a length past 2^31-1 comes back negative
            int declared = Snappy.uncompressedLength(body);
            if (declared < 0 || declared > maxBytes) {
                throw new IngestionException(String.format(
                        "Declared uncompressed size %d exceeds limit of %d bytes",
                        Integer.toUnsignedLong(declared), maxBytes), IngestionException.DECODE_ERROR);
            }
            if (!Snappy.isValidCompressedBuffer(body)) {
                throw new IngestionException("Invalid snappy payload", IngestionException.DECODE_ERROR);
            }
            return Snappy.uncompress(body);
        } catch (IngestionException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new IngestionException("Invalid snappy payload: " + e.getMessage(),
                    IngestionException.DECODE_ERROR, e);
        }
    }

    // ==================== Protobuf Readers ====================

    private List<TimeSeries> readWriteRequest(CodedInputStream in) throws IOException {
        List<TimeSeries> series = new ArrayList<>();
        int tag;
        while ((tag = in.readTag()) != 0) {
            if (isMessageField(tag, WRITE_REQUEST_TIMESERIES)) {
                int limit = in.pushLimit(in.readRawVarint32());
                series.add(readTimeSeries(in));
                in.popLimit(limit);
            } else if (!in.skipField(tag)) {
                break;
            }
        }
        return series;
    }

    private TimeSeries readTimeSeries(CodedInputStream in) throws IOException {
        List<Label> labels = new ArrayList<>();
        List<Sample> samples = new ArrayList<>();
        int tag;
        while ((tag = in.readTag()) != 0) {
            if (isMessageField(tag, TIMESERIES_LABELS)) {
                int limit = in.pushLimit(in.readRawVarint32());
                labels.add(readLabel(in));
                in.popLimit(limit);
            } else if (isMessageField(tag, TIMESERIES_SAMPLES)) {
                int limit = in.pushLimit(in.readRawVarint32());
                samples.add(readSample(in));
                in.popLimit(limit);
            } else if (!in.skipField(tag)) {
                break;
            }
        }
        return new TimeSeries(labels, samples);
    }

    private Label readLabel(CodedInputStream in) throws IOException {
        String name = "";
        String value = "";
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case LABEL_NAME -> name = in.readString();
                case LABEL_VALUE -> value = in.readString();
                default -> {
                    if (!in.skipField(tag)) {
                        return new Label(name, value);
                    }
                }
            }
        }
        return new Label(name, value);
    }

    private Sample readSample(CodedInputStream in) throws IOException {
        double value = 0;
        long timestamp = 0;
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case SAMPLE_VALUE -> value = in.readDouble();
                case SAMPLE_TIMESTAMP -> timestamp = in.readInt64();
                default -> {
                    if (!in.skipField(tag)) {
                        return new Sample(value, timestamp);
                    }
                }
            }
        }
        return new Sample(value, timestamp);
    }

    private static boolean isMessageField(int tag, int fieldNumber) {
        return WireFormat.getTagFieldNumber(tag) == fieldNumber
                && WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED;
    }
}
