package com.series.writer.service.ingest;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Terminal result of processing one staging file.
 */
public record UploadOutcome(
        Path file,
        UUID correlationId,
        UploadState state,
        int attempts
) {
    public boolean succeeded() {
        return state == UploadState.SUCCEEDED;
    }
}
