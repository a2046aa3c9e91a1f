package com.statgrid.service.core.status;

import java.time.Instant;

/** Operational view of a matrix's sync progress, built without scanning fact data. */
public record MatrixSyncStatus(
        long matrixId,
        Instant lastFullSyncAt,
        Instant lastPartialSyncAt,
        long chunkCount,
        long totalRows,
        Instant oldestChunkSync,
        Instant newestChunkSync) {}
