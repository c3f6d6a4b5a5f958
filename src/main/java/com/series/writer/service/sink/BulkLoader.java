package com.series.writer.service.sink;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Sink-side capability that loads a staging file into permanent storage.
 *
 * The sink recognises repeated submissions of the same logical upload by the
 * correlation id and must not apply an already completed one twice.
 */
public interface BulkLoader {

    /**
     * Loads a staging file into the destination.
     *
     * @param file                  the staging file
     * @param destination           target database, table and mapping
     * @param correlationId         identifier shared by every attempt for this file
     * @param deleteSourceOnSuccess delete the file once the sink has accepted it
     * @return the load result
     * @throws com.series.writer.service.ingest.IngestionException if the load fails
     */
    LoadResult ingest(Path file, DestinationDescriptor destination, UUID correlationId, boolean deleteSourceOnSuccess);

    /**
     * Result of an accepted load.
     */
    record LoadResult(
            UUID correlationId,
            String fileName,
            long bytes,
            int statusCode,
            boolean sourceDeleted
    ) {
    }
}
