package com.statgrid.service.core.checkpoint;

import com.statgrid.service.core.support.Sha256;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Per-chunk sync state. Chunk signatures can be far longer than an index key allows, so rows are
 * keyed by the SHA-256 of the signature and the signature itself is kept unindexed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckpointService {

    private final CheckpointRepository checkpoints;
    private final Clock clock;

    public static String chunkHash(String chunkSignature) {
        return Sha256.hex(Objects.requireNonNull(chunkSignature, "chunkSignature"));
    }

    public Optional<CheckpointInfo> getLastCheckpoint(long matrixId, String chunkSignature) {
        return checkpoints.find(matrixId, chunkHash(chunkSignature));
    }

    public void saveCheckpoint(long matrixId, String chunkSignature, long rowCount) {
        checkpoints.upsert(matrixId, chunkHash(chunkSignature), chunkSignature, rowCount, clock.instant());
    }

    public boolean shouldResync(long matrixId, String chunkSignature, ResyncOptions options) {
        if (options.forceRefresh()) {
            return true;
        }
        Optional<CheckpointInfo> last = getLastCheckpoint(matrixId, chunkSignature);
        if (last.isEmpty()) {
            return true;
        }
        Duration maxAge = options.maxAge();
        if (maxAge == null) {
            return false;
        }
        Instant now = clock.instant();
        return Duration.between(last.get().lastSyncedAt(), now).compareTo(maxAge) > 0;
    }

    public List<MatrixCheckpoint> getMatrixCheckpoints(long matrixId) {
        return checkpoints.findByMatrix(matrixId);
    }

    public long getMatrixTotalRows(long matrixId) {
        return checkpoints.stats(matrixId).totalRows();
    }

    public CheckpointStats getMatrixCheckpointStats(long matrixId) {
        return checkpoints.stats(matrixId);
    }

    /** Forces every chunk of the matrix to be synced again on the next run. */
    public int clearMatrixCheckpoints(long matrixId) {
        int deleted = checkpoints.deleteByMatrix(matrixId);
        log.info("Cleared {} checkpoints for matrix {}", deleted, matrixId);
        return deleted;
    }
}
