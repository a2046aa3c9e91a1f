package com.statgrid.service.core.classification;

import com.statgrid.core.model.ClassificationType;
import com.statgrid.core.model.ClassificationValue;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcClassificationRepository implements ClassificationRepository {

    private static final String TYPE_COLUMNS = "id, code, name, is_hierarchical";
    private static final String VALUE_COLUMNS =
            "id, classification_type_id, code, content_hash, name, name_normalized, parent_id, path, level, sort_order";

    private static final String INSERT_TYPE_SQL =
            """
            INSERT INTO classification_types (code, name, is_hierarchical)
            VALUES (:code, :name, :hierarchical)
            ON CONFLICT (code) DO NOTHING
            RETURNING id, code, name, is_hierarchical
            """;

    private static final String INSERT_VALUE_SQL =
            """
            INSERT INTO classification_values (
                classification_type_id, code, content_hash, name, name_normalized, parent_id, path, level, sort_order)
            VALUES (:typeId, :code, :contentHash, :name, :nameNormalized, :parentId, :path, :level, :sortOrder)
            ON CONFLICT (classification_type_id, content_hash) DO NOTHING
            RETURNING id, classification_type_id, code, content_hash, name, name_normalized, parent_id, path, level, sort_order
            """;

    private static final RowMapper<ClassificationType> TYPE_MAPPER = (rs, rowNum) -> new ClassificationType(
            rs.getLong("id"), rs.getString("code"), rs.getString("name"), rs.getBoolean("is_hierarchical"));

    private static final RowMapper<ClassificationValue> VALUE_MAPPER = (rs, rowNum) -> new ClassificationValue(
            rs.getLong("id"),
            rs.getLong("classification_type_id"),
            rs.getString("code"),
            rs.getString("content_hash"),
            rs.getString("name"),
            rs.getString("name_normalized"),
            rs.getObject("parent_id", Long.class),
            rs.getString("path"),
            rs.getInt("level"),
            rs.getInt("sort_order"));

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public Optional<ClassificationType> findTypeById(long id) {
        return jdbc
                .query(
                        "SELECT " + TYPE_COLUMNS + " FROM classification_types WHERE id = :id",
                        new MapSqlParameterSource("id", id),
                        TYPE_MAPPER)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<ClassificationType> findTypeByCode(String code) {
        return jdbc
                .query(
                        "SELECT " + TYPE_COLUMNS + " FROM classification_types WHERE code = :code",
                        new MapSqlParameterSource("code", code),
                        TYPE_MAPPER)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<ClassificationType> insertTypeIfAbsent(String code, String name, boolean hierarchical) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("code", code)
                .addValue("name", name)
                .addValue("hierarchical", hierarchical);
        return jdbc.query(INSERT_TYPE_SQL, params, TYPE_MAPPER).stream().findFirst();
    }

    @Override
    public Optional<ClassificationValue> findValueById(long id) {
        return jdbc
                .query(
                        "SELECT " + VALUE_COLUMNS + " FROM classification_values WHERE id = :id",
                        new MapSqlParameterSource("id", id),
                        VALUE_MAPPER)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<ClassificationValue> findValue(long typeId, String contentHash) {
        MapSqlParameterSource params =
                new MapSqlParameterSource().addValue("typeId", typeId).addValue("hash", contentHash);
        return jdbc
                .query(
                        "SELECT " + VALUE_COLUMNS
                                + " FROM classification_values WHERE classification_type_id = :typeId"
                                + " AND content_hash = :hash",
                        params,
                        VALUE_MAPPER)
                .stream()
                .findFirst();
    }

    @Override
    public Optional<ClassificationValue> insertValueIfAbsent(ClassificationValue draft) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("typeId", draft.typeId())
                .addValue("code", draft.code())
                .addValue("contentHash", draft.contentHash())
                .addValue("name", draft.name())
                .addValue("nameNormalized", draft.nameNormalized())
                .addValue("parentId", draft.parentId())
                .addValue("path", draft.path())
                .addValue("level", draft.level())
                .addValue("sortOrder", draft.sortOrder());
        return jdbc.query(INSERT_VALUE_SQL, params, VALUE_MAPPER).stream().findFirst();
    }
}
