package com.series.writer.service.ingest;

import com.series.writer.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of IdempotencyCache.
 *
 * Mappings are not persisted; a restart hands out fresh identifiers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryIdempotencyCache implements IdempotencyCache {

    private final MetricsConfig metricsConfig;

    private final Map<Path, UUID> correlationIds = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        metricsConfig.registerQueueGauge(
                "series.idempotency.size",
                "Number of staging files with an in-flight correlation id",
                this::size
        );
    }

    @Override
    public UUID getOrCreate(Path file) {
        return correlationIds.computeIfAbsent(normalize(file), key -> {
            UUID id = UUID.randomUUID();
            log.debug("Bound correlation id {} to {}", id, key);
            return id;
        });
    }

    @Override
    public Optional<UUID> release(Path file) {
        UUID removed = correlationIds.remove(normalize(file));
        if (removed != null) {
            log.debug("Released correlation id {} for {}", removed, file);
        }
        return Optional.ofNullable(removed);
    }

    @Override
    public int size() {
        return correlationIds.size();
    }

    private Path normalize(Path file) {
        return file.toAbsolutePath().normalize();
    }
}
