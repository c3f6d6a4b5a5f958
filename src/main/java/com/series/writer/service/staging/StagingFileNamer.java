package com.series.writer.service.staging;

import com.series.writer.service.config.WriterConfig;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Derives staging file names from the drain timestamp.
 *
 * Names look like {@code timeseries_20240101120000123_000042.json}: UTC drain time
 * to the millisecond plus a sequence number, so two drains in the same millisecond
 * never share a name.
 */
@Component
public class StagingFileNamer {

    static final String EXTENSION = ".json";
    static final String TEMP_SUFFIX = ".tmp";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmssSSS").withZone(ZoneOffset.UTC);

    private final Path directory;
    private final String prefix;
    private final AtomicLong sequence = new AtomicLong();

    public StagingFileNamer(WriterConfig config) {
        this.directory = Paths.get(config.getStaging().getDirectory()).toAbsolutePath().normalize();
        this.prefix = config.getStaging().getFilePrefix();
    }

    public Path directory() {
        return directory;
    }

    /**
     * Returns the path for a batch drained at the given instant.
     */
    public Path next(Instant drainedAt) {
        String name = String.format("%s_%s_%06d%s",
                prefix, TIMESTAMP.format(drainedAt), sequence.incrementAndGet(), EXTENSION);
        return directory.resolve(name);
    }

    /**
     * Returns the in-progress path a staging file is written to before it is published.
     */
    public static Path tempPathFor(Path target) {
        return target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
    }
}
