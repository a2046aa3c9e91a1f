package com.statgrid.service.core.territory;

import com.statgrid.core.model.Territory;
import com.statgrid.core.model.TerritoryLevel;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcTerritoryRepository implements TerritoryRepository {

    private static final String SELECT_COLUMNS =
            "SELECT id, code, siruta_code, level, parent_id, path, name, name_normalized FROM territories ";

    private static final RowMapper<Territory> ROW_MAPPER = (rs, rowNum) -> new Territory(
            rs.getLong("id"),
            rs.getString("code"),
            rs.getString("siruta_code"),
            TerritoryLevel.valueOf(rs.getString("level")),
            rs.getObject("parent_id", Long.class),
            rs.getString("path"),
            rs.getString("name"),
            rs.getString("name_normalized"));

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public Optional<Territory> findByCode(String code) {
        return jdbc
                .query(SELECT_COLUMNS + "WHERE code = :code", new MapSqlParameterSource("code", code), ROW_MAPPER)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<Territory> findByExternalCode(String externalCode) {
        return jdbc
                .query(
                        SELECT_COLUMNS + "WHERE siruta_code = :code",
                        new MapSqlParameterSource("code", externalCode),
                        ROW_MAPPER)
                .stream()
                .findFirst();
    }
}
