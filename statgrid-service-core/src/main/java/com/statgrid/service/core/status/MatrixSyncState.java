package com.statgrid.service.core.status;

import java.time.Instant;

/** Outcome of the most recent sync runs of a matrix. */
public record MatrixSyncState(
        long matrixId,
        Instant lastFullSyncAt,
        Instant lastPartialSyncAt,
        Instant lastRunAt,
        int lastRunChunksSynced,
        int lastRunChunksFresh,
        int lastRunChunksFailed,
        long lastRunRowsWritten) {}
