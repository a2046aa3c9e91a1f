package com.statgrid.service.core.statistic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.stream.LongStream;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementSetter;
import org.springframework.jdbc.core.RowMapper;

class JdbcStatisticRepositoryTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
    private final JdbcStatisticRepository repository = new JdbcStatisticRepository(jdbcTemplate);

    @Test
    @SuppressWarnings("unchecked")
    void countsInsertsAndUpdatesFromReturnedFlags() {
        when(jdbcTemplate.query(anyString(), any(PreparedStatementSetter.class), any(RowMapper.class)))
                .thenReturn(List.of(true, false, true));

        BatchCounts counts = repository.upsertBatch(7L, batch(3), NOW);

        assertThat(counts.inserted()).isEqualTo(2);
        assertThat(counts.updated()).isEqualTo(1);
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).query(sql.capture(), any(PreparedStatementSetter.class), any(RowMapper.class));
        assertThat(sql.getValue())
                .contains("ON CONFLICT (matrix_id, natural_key_hash)")
                .contains("version = statistics.version + 1")
                .contains("RETURNING (xmax = 0) AS inserted");
        assertThat(sql.getValue().split("\\(\\?, \\?", -1)).hasSize(4);
    }

    @Test
    @SuppressWarnings("unchecked")
    void missingPartitionErrorIsTranslated() {
        SQLException cause = new SQLException(
                "no partition of relation \"statistics\" found for row", "23514");
        when(jdbcTemplate.query(anyString(), any(PreparedStatementSetter.class), any(RowMapper.class)))
                .thenThrow(new DataIntegrityViolationException("insert failed", cause));

        assertThatThrownBy(() -> repository.upsertBatch(7L, batch(1), NOW))
                .isInstanceOf(MissingPartitionException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class)
                .satisfies(ex -> assertThat(((MissingPartitionException) ex).getMatrixId()).isEqualTo(7L));
    }

    @Test
    @SuppressWarnings("unchecked")
    void otherCheckViolationsPassThrough() {
        SQLException cause = new SQLException("new row violates check constraint \"ck_value\"", "23514");
        DataIntegrityViolationException failure = new DataIntegrityViolationException("insert failed", cause);
        when(jdbcTemplate.query(anyString(), any(PreparedStatementSetter.class), any(RowMapper.class)))
                .thenThrow(failure);

        assertThatThrownBy(() -> repository.upsertBatch(7L, batch(1), NOW)).isSameAs(failure);
    }

    @Test
    void emptyBatchSkipsDatabase() {
        assertThat(repository.upsertBatch(7L, List.of(), NOW)).isEqualTo(new BatchCounts(0, 0));
        verifyNoInteractions(jdbcTemplate);
    }

    private static List<KeyedStatistic> batch(int size) {
        NaturalKeyHasher hasher = new NaturalKeyHasher();
        return LongStream.rangeClosed(1, size)
                .mapToObj(t -> new StatisticRow(7L, t, 1L, null, List.of(), 1.0, null, "chunk"))
                .map(row -> new KeyedStatistic(hasher.hash(row), row))
                .toList();
    }
}
