package com.series.writer.service.ingest;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A fully written staging file waiting to be uploaded.
 *
 * @param path        location of the staging file
 * @param recordCount number of series in the file
 * @param stagedAt    drain time the file name was derived from
 */
public record StagedFile(Path path, int recordCount, Instant stagedAt) {

    public String fileName() {
        return path.getFileName().toString();
    }
}
