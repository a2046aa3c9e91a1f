package com.statgrid.service.core.checkpoint;

import java.time.Instant;

/** Full checkpoint row, used for listings. */
public record MatrixCheckpoint(
        long matrixId, String chunkHash, String chunkSignature, Instant lastSyncedAt, long rowCount) {}
