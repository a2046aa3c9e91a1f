package com.statgrid.service.core.time;

import com.statgrid.core.model.Periodicity;
import com.statgrid.core.model.TimePeriod;
import java.sql.Date;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcTimePeriodRepository implements TimePeriodRepository {

    private static final String COLUMNS =
            "id, year, quarter, month, periodicity, ins_label, label_en, period_start, period_end";

    private static final String SELECT_SQL = "SELECT " + COLUMNS
            + """
             FROM time_periods
            WHERE year = :year
              AND COALESCE(quarter, 0) = :quarter
              AND COALESCE(month, 0) = :month
              AND periodicity = :periodicity
            """;

    private static final String INSERT_SQL =
            """
            INSERT INTO time_periods (year, quarter, month, periodicity, ins_label, label_en, period_start, period_end)
            VALUES (:year, :quarterOrNull, :monthOrNull, :periodicity, :label, :labelEn, :periodStart, :periodEnd)
            ON CONFLICT (year, (COALESCE(quarter, 0)), (COALESCE(month, 0)), periodicity) DO NOTHING
            RETURNING """
            + " " + COLUMNS;

    private static final RowMapper<TimePeriod> ROW_MAPPER = (rs, rowNum) -> new TimePeriod(
            rs.getLong("id"),
            rs.getInt("year"),
            rs.getObject("quarter", Integer.class),
            rs.getObject("month", Integer.class),
            Periodicity.valueOf(rs.getString("periodicity")),
            rs.getString("ins_label"),
            rs.getString("label_en"),
            rs.getDate("period_start").toLocalDate(),
            rs.getDate("period_end").toLocalDate());

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public Optional<TimePeriod> find(ParsedTimePeriod period) {
        return jdbc.query(SELECT_SQL, keyParams(period), ROW_MAPPER).stream().findFirst();
    }

    @Override
    public Optional<TimePeriod> insertIfAbsent(ParsedTimePeriod period, String label, String labelEn) {
        MapSqlParameterSource params = keyParams(period)
                .addValue("quarterOrNull", period.quarter())
                .addValue("monthOrNull", period.month())
                .addValue("label", label)
                .addValue("labelEn", labelEn)
                .addValue("periodStart", Date.valueOf(period.periodStart()))
                .addValue("periodEnd", Date.valueOf(period.periodEnd()));
        return jdbc.query(INSERT_SQL, params, ROW_MAPPER).stream().findFirst();
    }

    private static MapSqlParameterSource keyParams(ParsedTimePeriod period) {
        return new MapSqlParameterSource()
                .addValue("year", period.year())
                .addValue("quarter", period.quarter() == null ? 0 : period.quarter())
                .addValue("month", period.month() == null ? 0 : period.month())
                .addValue("periodicity", period.periodicity().name());
    }
}
