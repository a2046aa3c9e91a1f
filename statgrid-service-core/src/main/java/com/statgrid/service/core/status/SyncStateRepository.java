package com.statgrid.service.core.status;

import java.time.Instant;
import java.util.Optional;

public interface SyncStateRepository {

    Optional<MatrixSyncState> find(long matrixId);

    /**
     * Records a run. A complete run moves the last full sync time, any other run the last partial
     * sync time; the other timestamp is kept.
     */
    void recordRun(
            long matrixId,
            boolean complete,
            Instant runAt,
            int chunksSynced,
            int chunksFresh,
            int chunksFailed,
            long rowsWritten);
}
