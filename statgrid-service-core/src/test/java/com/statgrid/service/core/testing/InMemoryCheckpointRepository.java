package com.statgrid.service.core.testing;

import com.statgrid.service.core.checkpoint.CheckpointInfo;
import com.statgrid.service.core.checkpoint.CheckpointRepository;
import com.statgrid.service.core.checkpoint.CheckpointStats;
import com.statgrid.service.core.checkpoint.MatrixCheckpoint;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class InMemoryCheckpointRepository implements CheckpointRepository {

    private record Key(long matrixId, String chunkHash) {}

    private final Map<Key, MatrixCheckpoint> rows = new LinkedHashMap<>();

    @Override
    public synchronized Optional<CheckpointInfo> find(long matrixId, String chunkHash) {
        return Optional.ofNullable(rows.get(new Key(matrixId, chunkHash)))
                .map(c -> new CheckpointInfo(c.lastSyncedAt(), c.rowCount()));
    }

    @Override
    public synchronized void upsert(
            long matrixId, String chunkHash, String chunkSignature, long rowCount, Instant syncedAt) {
        rows.put(
                new Key(matrixId, chunkHash),
                new MatrixCheckpoint(matrixId, chunkHash, chunkSignature, syncedAt, rowCount));
    }

    @Override
    public synchronized List<MatrixCheckpoint> findByMatrix(long matrixId) {
        return rows.values().stream()
                .filter(c -> c.matrixId() == matrixId)
                .sorted(Comparator.comparing(MatrixCheckpoint::lastSyncedAt).reversed())
                .toList();
    }

    @Override
    public synchronized CheckpointStats stats(long matrixId) {
        List<MatrixCheckpoint> matrix = findByMatrix(matrixId);
        if (matrix.isEmpty()) {
            return CheckpointStats.empty();
        }
        return new CheckpointStats(
                matrix.size(),
                matrix.stream().mapToLong(MatrixCheckpoint::rowCount).sum(),
                matrix.stream().map(MatrixCheckpoint::lastSyncedAt).min(Comparator.naturalOrder()).orElseThrow(),
                matrix.stream().map(MatrixCheckpoint::lastSyncedAt).max(Comparator.naturalOrder()).orElseThrow());
    }

    @Override
    public synchronized int deleteByMatrix(long matrixId) {
        int before = rows.size();
        rows.keySet().removeIf(k -> k.matrixId() == matrixId);
        return before - rows.size();
    }

    public synchronized int size() {
        return rows.size();
    }
}
