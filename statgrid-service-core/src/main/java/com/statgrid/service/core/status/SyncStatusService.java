package com.statgrid.service.core.status;

import com.statgrid.service.core.checkpoint.CheckpointService;
import com.statgrid.service.core.checkpoint.CheckpointStats;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SyncStatusService {

    private final CheckpointService checkpoints;
    private final SyncStateRepository syncState;

    public MatrixSyncStatus status(long matrixId) {
        CheckpointStats stats = checkpoints.getMatrixCheckpointStats(matrixId);
        Optional<MatrixSyncState> state = syncState.find(matrixId);
        return new MatrixSyncStatus(
                matrixId,
                state.map(MatrixSyncState::lastFullSyncAt).orElse(null),
                state.map(MatrixSyncState::lastPartialSyncAt).orElse(null),
                stats.chunkCount(),
                stats.totalRows(),
                stats.oldestSync(),
                stats.newestSync());
    }

    /** Clears the matrix's checkpoints so every chunk is synced again on the next run. */
    public int forceResync(long matrixId) {
        return checkpoints.clearMatrixCheckpoints(matrixId);
    }
}
