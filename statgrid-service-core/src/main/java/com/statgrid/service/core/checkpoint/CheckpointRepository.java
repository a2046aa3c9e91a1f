package com.statgrid.service.core.checkpoint;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface CheckpointRepository {

    Optional<CheckpointInfo> find(long matrixId, String chunkHash);

    void upsert(long matrixId, String chunkHash, String chunkSignature, long rowCount, Instant syncedAt);

    List<MatrixCheckpoint> findByMatrix(long matrixId);

    CheckpointStats stats(long matrixId);

    int deleteByMatrix(long matrixId);
}
