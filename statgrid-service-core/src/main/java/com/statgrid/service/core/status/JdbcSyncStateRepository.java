package com.statgrid.service.core.status;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcSyncStateRepository implements SyncStateRepository {

    private static final String UPSERT_SQL =
            """
            INSERT INTO matrix_sync_state (
                matrix_id, last_full_sync_at, last_partial_sync_at, last_run_at,
                chunks_synced, chunks_fresh, chunks_failed, rows_written)
            VALUES (:matrixId, :fullAt, :partialAt, :runAt, :synced, :fresh, :failed, :rows)
            ON CONFLICT (matrix_id)
            DO UPDATE SET last_full_sync_at = COALESCE(EXCLUDED.last_full_sync_at, matrix_sync_state.last_full_sync_at),
                          last_partial_sync_at = COALESCE(EXCLUDED.last_partial_sync_at, matrix_sync_state.last_partial_sync_at),
                          last_run_at = EXCLUDED.last_run_at,
                          chunks_synced = EXCLUDED.chunks_synced,
                          chunks_fresh = EXCLUDED.chunks_fresh,
                          chunks_failed = EXCLUDED.chunks_failed,
                          rows_written = EXCLUDED.rows_written
            """;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public Optional<MatrixSyncState> find(long matrixId) {
        return jdbc
                .query(
                        """
                        SELECT matrix_id, last_full_sync_at, last_partial_sync_at, last_run_at,
                               chunks_synced, chunks_fresh, chunks_failed, rows_written
                          FROM matrix_sync_state
                         WHERE matrix_id = :matrixId
                        """,
                        new MapSqlParameterSource("matrixId", matrixId),
                        (rs, rowNum) -> mapRow(rs))
                .stream()
                .findFirst();
    }

    @Override
    public void recordRun(
            long matrixId,
            boolean complete,
            Instant runAt,
            int chunksSynced,
            int chunksFresh,
            int chunksFailed,
            long rowsWritten) {
        Timestamp ts = Timestamp.from(runAt);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("matrixId", matrixId)
                .addValue("fullAt", complete ? ts : null)
                .addValue("partialAt", complete ? null : ts)
                .addValue("runAt", ts)
                .addValue("synced", chunksSynced)
                .addValue("fresh", chunksFresh)
                .addValue("failed", chunksFailed)
                .addValue("rows", rowsWritten);
        jdbc.update(UPSERT_SQL, params);
    }

    private static MatrixSyncState mapRow(ResultSet rs) throws SQLException {
        return new MatrixSyncState(
                rs.getLong("matrix_id"),
                toInstant(rs.getTimestamp("last_full_sync_at")),
                toInstant(rs.getTimestamp("last_partial_sync_at")),
                toInstant(rs.getTimestamp("last_run_at")),
                rs.getInt("chunks_synced"),
                rs.getInt("chunks_fresh"),
                rs.getInt("chunks_failed"),
                rs.getLong("rows_written"));
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
