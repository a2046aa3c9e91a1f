package com.statgrid.service.core.resolve;

import java.sql.ResultSet;
import java.sql.SQLException;
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
public class JdbcLabelMappingRepository implements LabelMappingRepository {

    private static final String SELECT_SQL =
            """
            SELECT label_normalized, context_type, context_hint, label_original,
                   territory_id, time_period_id, classification_value_id, unit_id,
                   match_method, confidence, is_unresolvable, unresolvable_reason,
                   matrix_id, created_at, resolved_at
              FROM label_mappings
             WHERE label_normalized = :label
               AND context_type = :type
               AND context_hint = :hint
            """;

    private static final String INSERT_SQL =
            """
            INSERT INTO label_mappings (
                label_normalized, context_type, context_hint, label_original,
                territory_id, time_period_id, classification_value_id, unit_id,
                match_method, confidence, is_unresolvable, unresolvable_reason,
                matrix_id, created_at, resolved_at)
            VALUES (
                :label, :type, :hint, :original,
                :territoryId, :timePeriodId, :classificationValueId, :unitId,
                :method, :confidence, :unresolvable, :reason,
                :matrixId, :createdAt, :resolvedAt)
            ON CONFLICT (label_normalized, context_type, context_hint) DO NOTHING
            """;

    private static final String DELETE_BY_MATRIX_SQL = "DELETE FROM label_mappings WHERE matrix_id = :matrixId";

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public Optional<LabelMapping> find(String labelNormalized, ContextType contextType, String contextHint) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("label", labelNormalized)
                .addValue("type", contextType.name())
                .addValue("hint", contextHint);
        List<LabelMapping> rows = jdbc.query(SELECT_SQL, params, (rs, rowNum) -> mapRow(rs));
        return rows.stream().findFirst();
    }

    @Override
    public boolean insertIfAbsent(LabelMapping mapping) {
        Long id = mapping.entityId();
        ContextType type = mapping.contextType();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("label", mapping.labelNormalized())
                .addValue("type", type.name())
                .addValue("hint", mapping.contextHint())
                .addValue("original", mapping.labelOriginal())
                .addValue("territoryId", type == ContextType.TERRITORY ? id : null)
                .addValue("timePeriodId", type == ContextType.TIME_PERIOD ? id : null)
                .addValue("classificationValueId", type == ContextType.CLASSIFICATION ? id : null)
                .addValue("unitId", type == ContextType.UNIT ? id : null)
                .addValue("method", mapping.method() == null ? null : mapping.method().name())
                .addValue("confidence", mapping.confidence())
                .addValue("unresolvable", mapping.unresolvable())
                .addValue("reason", mapping.unresolvableReason())
                .addValue("matrixId", mapping.matrixId())
                .addValue("createdAt", toTimestamp(mapping.createdAt()))
                .addValue("resolvedAt", toTimestamp(mapping.resolvedAt()));
        return jdbc.update(INSERT_SQL, params) > 0;
    }

    @Override
    public int deleteByMatrix(long matrixId) {
        return jdbc.update(DELETE_BY_MATRIX_SQL, new MapSqlParameterSource("matrixId", matrixId));
    }

    private static LabelMapping mapRow(ResultSet rs) throws SQLException {
        ContextType type = ContextType.valueOf(rs.getString("context_type"));
        Long entityId =
                switch (type) {
                    case TERRITORY -> rs.getObject("territory_id", Long.class);
                    case TIME_PERIOD -> rs.getObject("time_period_id", Long.class);
                    case CLASSIFICATION -> rs.getObject("classification_value_id", Long.class);
                    case UNIT -> rs.getObject("unit_id", Long.class);
                };
        String method = rs.getString("match_method");
        return new LabelMapping(
                rs.getString("label_normalized"),
                type,
                rs.getString("context_hint"),
                rs.getString("label_original"),
                entityId,
                method == null ? null : ResolutionMethod.valueOf(method),
                rs.getObject("confidence", Double.class),
                rs.getBoolean("is_unresolvable"),
                rs.getString("unresolvable_reason"),
                rs.getObject("matrix_id", Long.class),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("resolved_at")));
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
