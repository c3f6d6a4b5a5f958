package com.series.writer.service.staging;

import com.series.writer.service.ingest.StagedFile;

import java.util.Optional;

/**
 * Interface for the staging writer.
 *
 * Moves everything currently buffered into one durable staging file and hands
 * the file to the ingestion queue. Safe to call from any number of triggers at once.
 */
public interface StagingWriter {

    /**
     * Drains the intake buffer and stages the batch.
     *
     * @return the staged file, or empty if the buffer was empty
     * @throws com.series.writer.service.ingest.IngestionException if the batch could not be
     *         written; the drained records are lost
     */
    Optional<StagedFile> flush();
}
