package com.statgrid.service.core.statistic;

import com.statgrid.service.core.support.SqlStates;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcStatisticRepository implements StatisticRepository {

    private static final String INSERT_PREFIX =
            """
            INSERT INTO statistics (
                matrix_id, territory_id, time_period_id, unit_id, classification_value_ids,
                value, value_status, source_chunk_hash, natural_key_hash, version, created_at, updated_at)
            VALUES
            """;

    private static final String ROW_PLACEHOLDER = "(?, ?, ?, ?, ?, ?, ?, ?, ?, 1, ?, ?)";

    private static final String CONFLICT_SUFFIX =
            """

            ON CONFLICT (matrix_id, natural_key_hash)
            DO UPDATE SET value = EXCLUDED.value,
                          value_status = EXCLUDED.value_status,
                          source_chunk_hash = EXCLUDED.source_chunk_hash,
                          updated_at = EXCLUDED.updated_at,
                          version = statistics.version + 1
            RETURNING (xmax = 0) AS inserted
            """;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public BatchCounts upsertBatch(long matrixId, List<KeyedStatistic> batch, Instant now) {
        if (batch.isEmpty()) {
            return new BatchCounts(0, 0);
        }
        String sql = INSERT_PREFIX + String.join(",\n", Collections.nCopies(batch.size(), ROW_PLACEHOLDER))
                + CONFLICT_SUFFIX;
        Timestamp ts = Timestamp.from(now);
        try {
            List<Boolean> flags = jdbcTemplate.query(
                    sql, ps -> bind(ps, batch, ts), (rs, rowNum) -> rs.getBoolean("inserted"));
            int inserted = (int) flags.stream().filter(Boolean::booleanValue).count();
            return new BatchCounts(inserted, flags.size() - inserted);
        } catch (DataAccessException ex) {
            if (isMissingPartition(ex)) {
                throw new MissingPartitionException(matrixId, ex);
            }
            throw ex;
        }
    }

    private static void bind(PreparedStatement ps, List<KeyedStatistic> batch, Timestamp ts) throws SQLException {
        int p = 1;
        for (KeyedStatistic item : batch) {
            StatisticRow row = item.row();
            ps.setLong(p++, row.matrixId());
            ps.setObject(p++, row.territoryId(), Types.BIGINT);
            ps.setObject(p++, row.timePeriodId(), Types.BIGINT);
            ps.setObject(p++, row.unitId(), Types.BIGINT);
            ps.setArray(p++, ps.getConnection().createArrayOf("bigint", row.classificationValueIds().toArray()));
            ps.setObject(p++, row.value(), Types.DOUBLE);
            ps.setString(p++, row.valueStatus());
            ps.setString(p++, row.sourceChunkHash());
            ps.setString(p++, item.naturalKeyHash());
            ps.setTimestamp(p++, ts);
            ps.setTimestamp(p++, ts);
        }
    }

    static boolean isMissingPartition(Throwable ex) {
        SQLException sqlEx = SqlStates.findSqlException(ex, SqlStates.CHECK_VIOLATION);
        return sqlEx != null && sqlEx.getMessage() != null && sqlEx.getMessage().contains("no partition");
    }
}
