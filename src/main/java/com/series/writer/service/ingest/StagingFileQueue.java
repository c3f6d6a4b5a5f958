package com.series.writer.service.ingest;

import java.util.Optional;

/**
 * Interface for the ingestion queue.
 *
 * Ordered hand-off of staged files from the staging writer to the ingestion worker.
 * Files are handed out in the order they were enqueued.
 */
public interface StagingFileQueue {

    /**
     * Enqueues a staged file. Never blocks.
     *
     * @param file the staged file
     */
    void enqueue(StagedFile file);

    /**
     * Waits up to the given timeout for the next staged file.
     *
     * @param timeoutMs timeout in milliseconds
     * @return the next file if one arrived in time, empty otherwise
     */
    Optional<StagedFile> dequeue(long timeoutMs);

    /**
     * Gets the number of files waiting to be uploaded.
     *
     * @return current queue size
     */
    int size();
}
