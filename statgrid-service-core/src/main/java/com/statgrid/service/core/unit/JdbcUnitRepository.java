package com.statgrid.service.core.unit;

import com.statgrid.core.model.UnitOfMeasure;
import java.sql.Array;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcUnitRepository implements UnitRepository {

    private static final String SELECT_SQL =
            "SELECT id, code, name, symbol, ins_labels FROM units_of_measure WHERE code = :code";

    private static final String INSERT_SQL =
            """
            INSERT INTO units_of_measure (code, name, symbol, ins_labels)
            VALUES (:code, :name, :symbol, ARRAY[:label]::text[])
            ON CONFLICT (code) DO NOTHING
            RETURNING id, code, name, symbol, ins_labels
            """;

    private static final String ADD_LABEL_SQL =
            """
            UPDATE units_of_measure
               SET ins_labels = array_append(ins_labels, :label)
             WHERE id = :id
               AND NOT (:label = ANY(ins_labels))
            """;

    private static final RowMapper<UnitOfMeasure> ROW_MAPPER = (rs, rowNum) -> {
        Array labels = rs.getArray("ins_labels");
        List<String> sourceLabels = labels == null ? List.of() : Arrays.asList((String[]) labels.getArray());
        return new UnitOfMeasure(
                rs.getLong("id"), rs.getString("code"), rs.getString("name"), rs.getString("symbol"), sourceLabels);
    };

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public Optional<UnitOfMeasure> findByCode(String code) {
        return jdbc.query(SELECT_SQL, new MapSqlParameterSource("code", code), ROW_MAPPER).stream()
                .findFirst();
    }

    @Override
    public Optional<UnitOfMeasure> insertIfAbsent(String code, String name, String symbol, String sourceLabel) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("code", code)
                .addValue("name", name)
                .addValue("symbol", symbol)
                .addValue("label", sourceLabel);
        return jdbc.query(INSERT_SQL, params, ROW_MAPPER).stream().findFirst();
    }

    @Override
    public void addSourceLabel(long unitId, String sourceLabel) {
        jdbc.update(ADD_LABEL_SQL, new MapSqlParameterSource().addValue("id", unitId).addValue("label", sourceLabel));
    }
}
