package com.statgrid.service.storage.impl;

import com.statgrid.service.core.statistic.PartitionCatalog;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Checks the Postgres catalog for the {@code statistics_matrix_<id>} partition of {@code statistics}.
 * Partitions are provisioned out of band and never dropped while the service runs, so positive
 * answers are remembered.
 */
@Service
public class PostgresPartitionCatalog implements PartitionCatalog {

    private static final Logger log = LoggerFactory.getLogger(PostgresPartitionCatalog.class);

    private static final String PARENT_TABLE = "statistics";

    private static final String EXISTS_SQL =
            """
            SELECT EXISTS (
                SELECT 1
                  FROM pg_inherits i
                  JOIN pg_class parent ON parent.oid = i.inhparent
                  JOIN pg_class child ON child.oid = i.inhrelid
                 WHERE parent.relname = ?
                   AND child.relname = ?)
            """;

    private final JdbcTemplate jdbc;
    private final Set<Long> known = ConcurrentHashMap.newKeySet();

    public PostgresPartitionCatalog(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public static String partitionName(long matrixId) {
        return PARENT_TABLE + "_matrix_" + matrixId;
    }

    @Override
    public boolean partitionExists(long matrixId) {
        if (known.contains(matrixId)) {
            return true;
        }
        Boolean exists = jdbc.queryForObject(EXISTS_SQL, Boolean.class, PARENT_TABLE, partitionName(matrixId));
        if (Boolean.TRUE.equals(exists)) {
            known.add(matrixId);
            return true;
        }
        log.debug("Partition {} not found", partitionName(matrixId));
        return false;
    }
}
