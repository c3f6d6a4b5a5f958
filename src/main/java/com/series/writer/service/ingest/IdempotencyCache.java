package com.series.writer.service.ingest;

import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps staging files to the correlation identifier presented to the sink.
 *
 * One identifier per file path, stable across every upload attempt of that file,
 * until the file reaches a terminal state and the mapping is released.
 * Implementations must be safe for concurrent use.
 */
public interface IdempotencyCache {

    /**
     * Returns the identifier bound to the path, creating and binding one atomically if absent.
     *
     * @param file the staging file
     * @return the correlation identifier
     */
    UUID getOrCreate(Path file);

    /**
     * Removes the mapping for the path.
     *
     * @param file the staging file
     * @return the released identifier, empty if none was bound
     */
    Optional<UUID> release(Path file);

    /**
     * Gets the number of files with a bound identifier.
     *
     * @return number of in-flight mappings
     */
    int size();
}
