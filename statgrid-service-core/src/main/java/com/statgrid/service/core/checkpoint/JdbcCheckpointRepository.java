package com.statgrid.service.core.checkpoint;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcCheckpointRepository implements CheckpointRepository {

    private static final String UPSERT_SQL =
            """
            INSERT INTO data_sync_checkpoints (
                matrix_id, chunk_hash, chunk_signature, last_synced_at, row_count, created_at, updated_at)
            VALUES (:matrixId, :hash, :signature, :syncedAt, :rowCount, :syncedAt, :syncedAt)
            ON CONFLICT (matrix_id, chunk_hash)
            DO UPDATE SET last_synced_at = EXCLUDED.last_synced_at,
                          row_count = EXCLUDED.row_count,
                          updated_at = EXCLUDED.updated_at
            """;

    private static final String STATS_SQL =
            """
            SELECT COUNT(*) AS chunk_count,
                   COALESCE(SUM(row_count), 0) AS total_rows,
                   MIN(last_synced_at) AS oldest_sync,
                   MAX(last_synced_at) AS newest_sync
              FROM data_sync_checkpoints
             WHERE matrix_id = :matrixId
            """;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public Optional<CheckpointInfo> find(long matrixId, String chunkHash) {
        MapSqlParameterSource params =
                new MapSqlParameterSource().addValue("matrixId", matrixId).addValue("hash", chunkHash);
        return jdbc
                .query(
                        "SELECT last_synced_at, row_count FROM data_sync_checkpoints"
                                + " WHERE matrix_id = :matrixId AND chunk_hash = :hash",
                        params,
                        (rs, rowNum) -> new CheckpointInfo(
                                rs.getTimestamp("last_synced_at").toInstant(), rs.getLong("row_count")))
                .stream()
                .findFirst();
    }

    @Override
    public void upsert(long matrixId, String chunkHash, String chunkSignature, long rowCount, Instant syncedAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("matrixId", matrixId)
                .addValue("hash", chunkHash)
                .addValue("signature", chunkSignature)
                .addValue("rowCount", rowCount)
                .addValue("syncedAt", Timestamp.from(syncedAt));
        jdbc.update(UPSERT_SQL, params);
    }

    @Override
    public List<MatrixCheckpoint> findByMatrix(long matrixId) {
        return jdbc.query(
                """
                SELECT matrix_id, chunk_hash, chunk_signature, last_synced_at, row_count
                  FROM data_sync_checkpoints
                 WHERE matrix_id = :matrixId
                 ORDER BY last_synced_at DESC
                """,
                new MapSqlParameterSource("matrixId", matrixId),
                (rs, rowNum) -> new MatrixCheckpoint(
                        rs.getLong("matrix_id"),
                        rs.getString("chunk_hash"),
                        rs.getString("chunk_signature"),
                        rs.getTimestamp("last_synced_at").toInstant(),
                        rs.getLong("row_count")));
    }

    @Override
    public CheckpointStats stats(long matrixId) {
        CheckpointStats stats = jdbc.queryForObject(
                STATS_SQL, new MapSqlParameterSource("matrixId", matrixId), (rs, rowNum) -> {
                    Timestamp oldest = rs.getTimestamp("oldest_sync");
                    Timestamp newest = rs.getTimestamp("newest_sync");
                    return new CheckpointStats(
                            rs.getLong("chunk_count"),
                            rs.getLong("total_rows"),
                            oldest == null ? null : oldest.toInstant(),
                            newest == null ? null : newest.toInstant());
                });
        return stats == null ? CheckpointStats.empty() : stats;
    }

    @Override
    public int deleteByMatrix(long matrixId) {
        return jdbc.update(
                "DELETE FROM data_sync_checkpoints WHERE matrix_id = :matrixId",
                new MapSqlParameterSource("matrixId", matrixId));
    }
}
