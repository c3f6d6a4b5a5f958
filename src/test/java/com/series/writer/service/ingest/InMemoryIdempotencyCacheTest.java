package com.series.writer.service.ingest;

import com.series.writer.service.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryIdempotencyCacheTest {

    private InMemoryIdempotencyCache cache;

    @BeforeEach
    void setUp() {
        cache = new InMemoryIdempotencyCache(TestFixtures.metrics());
    }

    @Test
    @DisplayName("The same path keeps its id until released")
    void stableUntilReleased() {
        Path file = Path.of("staging", "timeseries_1.json");

        UUID first = cache.getOrCreate(file);
        UUID second = cache.getOrCreate(file);

        assertThat(second).isEqualTo(first);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.release(file)).contains(first);
        assertThat(cache.release(file)).isEmpty();
        assertThat(cache.getOrCreate(file)).isNotEqualTo(first);
    }

    @Test
    @DisplayName("Equivalent paths share one id")
    void normalizesPaths() {
        Path file = Path.of("staging", "timeseries_1.json");

        UUID id = cache.getOrCreate(file);

        assertThat(cache.getOrCreate(file.toAbsolutePath())).isEqualTo(id);
        assertThat(cache.getOrCreate(Path.of("staging", ".", "timeseries_1.json"))).isEqualTo(id);
    }

    @Test
    @DisplayName("Different files get different ids")
    void distinctPerFile() {
        assertThat(cache.getOrCreate(Path.of("a.json")))
                .isNotEqualTo(cache.getOrCreate(Path.of("b.json")));
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Concurrent callers for one path all observe the same id")
    void concurrentGetOrCreate() throws Exception {
        Path file = Path.of("shared.json");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Callable<UUID>> calls = IntStream.range(0, 64)
                .<Callable<UUID>>mapToObj(i -> () -> cache.getOrCreate(file))
                .toList();

        Set<UUID> ids = pool.invokeAll(calls).stream()
                .map(InMemoryIdempotencyCacheTest::join)
                .collect(Collectors.toSet());
        pool.shutdown();

        assertThat(ids).hasSize(1);
    }

    private static UUID join(Future<UUID> future) {
        try {
            return future.get();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
