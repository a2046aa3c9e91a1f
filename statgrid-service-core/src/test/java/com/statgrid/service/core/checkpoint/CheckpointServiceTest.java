package com.statgrid.service.core.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;

import com.statgrid.service.core.testing.InMemoryCheckpointRepository;
import com.statgrid.service.core.testing.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class CheckpointServiceTest {

    private static final long MATRIX = 1234L;
    private static final String CHUNK = "1,2,3:10,11:2023,2024";

    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    private final InMemoryCheckpointRepository repository = new InMemoryCheckpointRepository();
    private final CheckpointService service = new CheckpointService(repository, clock);

    @Test
    void neverSyncedChunkNeedsResync() {
        assertThat(service.shouldResync(MATRIX, CHUNK, ResyncOptions.DEFAULT)).isTrue();
        assertThat(service.getLastCheckpoint(MATRIX, CHUNK)).isEmpty();
    }

    @Test
    void resyncHonoursMaxAge() {
        service.saveCheckpoint(MATRIX, CHUNK, 10);
        clock.advance(Duration.ofMinutes(1));

        assertThat(service.shouldResync(MATRIX, CHUNK, ResyncOptions.maxAge(Duration.ofHours(1))))
                .isFalse();
        assertThat(service.shouldResync(MATRIX, CHUNK, ResyncOptions.maxAge(Duration.ofSeconds(30))))
                .isTrue();
    }

    @Test
    void syncedChunkWithoutMaxAgeStaysFresh() {
        service.saveCheckpoint(MATRIX, CHUNK, 10);
        clock.advance(Duration.ofDays(3650));

        assertThat(service.shouldResync(MATRIX, CHUNK, ResyncOptions.DEFAULT)).isFalse();
    }

    @Test
    void forceRefreshAlwaysResyncs() {
        service.saveCheckpoint(MATRIX, CHUNK, 10);

        assertThat(service.shouldResync(MATRIX, CHUNK, ResyncOptions.force())).isTrue();
        assertThat(service.shouldResync(MATRIX, CHUNK, new ResyncOptions(true, Duration.ofDays(1))))
                .isTrue();
    }

    @Test
    void saveUpdatesTimestampAndRowCount() {
        service.saveCheckpoint(MATRIX, CHUNK, 10);
        clock.advance(Duration.ofHours(2));
        service.saveCheckpoint(MATRIX, CHUNK, 25);

        CheckpointInfo info = service.getLastCheckpoint(MATRIX, CHUNK).orElseThrow();
        assertThat(info.rowCount()).isEqualTo(25);
        assertThat(info.lastSyncedAt()).isEqualTo(clock.instant());
        assertThat(repository.size()).isEqualTo(1);
    }

    @Test
    void multiKilobyteSignatureIsIndexedByFixedWidthHash() {
        String localities = IntStream.rangeClosed(1, 3000)
                .mapToObj(Integer::toString)
                .collect(Collectors.joining(","));
        String signature = "1:" + localities + ":2023";
        assertThat(signature.length()).isGreaterThan(8_000);

        service.saveCheckpoint(MATRIX, signature, 3000);

        assertThat(service.getLastCheckpoint(MATRIX, signature)).map(CheckpointInfo::rowCount).contains(3000L);
        assertThat(service.getLastCheckpoint(MATRIX, signature + ",3001")).isEmpty();
        MatrixCheckpoint stored = service.getMatrixCheckpoints(MATRIX).get(0);
        assertThat(stored.chunkHash()).hasSize(64).isEqualTo(CheckpointService.chunkHash(signature));
        assertThat(stored.chunkSignature()).isEqualTo(signature);
    }

    @Test
    void statsAggregatePerMatrix() {
        service.saveCheckpoint(MATRIX, "a", 10);
        Instant oldest = clock.instant();
        clock.advance(Duration.ofHours(1));
        service.saveCheckpoint(MATRIX, "b", 5);
        service.saveCheckpoint(999L, "a", 100);

        CheckpointStats stats = service.getMatrixCheckpointStats(MATRIX);
        assertThat(stats.chunkCount()).isEqualTo(2);
        assertThat(stats.totalRows()).isEqualTo(15);
        assertThat(stats.oldestSync()).isEqualTo(oldest);
        assertThat(stats.newestSync()).isEqualTo(clock.instant());
        assertThat(service.getMatrixTotalRows(MATRIX)).isEqualTo(15);
        assertThat(service.getMatrixCheckpointStats(42L)).isEqualTo(CheckpointStats.empty());
    }

    @Test
    void clearingForcesResyncOfEveryChunkOfThatMatrixOnly() {
        service.saveCheckpoint(MATRIX, "a", 1);
        service.saveCheckpoint(MATRIX, "b", 1);
        service.saveCheckpoint(999L, "a", 1);

        assertThat(service.clearMatrixCheckpoints(MATRIX)).isEqualTo(2);
        assertThat(service.shouldResync(MATRIX, "a", ResyncOptions.DEFAULT)).isTrue();
        assertThat(service.shouldResync(MATRIX, "b", ResyncOptions.DEFAULT)).isTrue();
        assertThat(service.shouldResync(999L, "a", ResyncOptions.DEFAULT)).isFalse();
    }
}
