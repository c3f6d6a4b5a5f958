package com.series.writer.service.ingest;

/**
 * Upload states of a single staging file.
 *
 * PENDING → UPLOADING → SUCCEEDED
 *                     → RETRYING → UPLOADING
 *                     → PERMANENTLY_FAILED
 * A file that disappears before an attempt ends in ALREADY_HANDLED; a shutdown
 * during backoff ends in CANCELLED.
 */
public enum UploadState {
    PENDING,
    UPLOADING,
    RETRYING,
    SUCCEEDED,
    PERMANENTLY_FAILED,
    ALREADY_HANDLED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == PERMANENTLY_FAILED
                || this == ALREADY_HANDLED || this == CANCELLED;
    }
}
