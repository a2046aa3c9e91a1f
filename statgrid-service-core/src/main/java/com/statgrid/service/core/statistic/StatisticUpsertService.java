package com.statgrid.service.core.statistic;

import com.statgrid.service.core.config.StatgridProperties;
import com.statgrid.service.core.support.SqlStates;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Writes fact rows exactly once per natural key. Rows are keyed, collapsed (last wins), then
 * written in fixed-size batches, each in its own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatisticUpsertService {

    private final StatisticRepository statistics;
    private final PartitionCatalog partitions;
    private final NaturalKeyHasher hasher;
    private final TransactionTemplate txTemplate;
    private final StatgridProperties properties;
    private final Clock clock;

    public UpsertResult upsert(long matrixId, List<StatisticRow> rows) {
        if (rows.isEmpty()) {
            return UpsertResult.EMPTY;
        }
        requirePartition(matrixId);

        Map<String, KeyedStatistic> byKey = new LinkedHashMap<>();
        for (StatisticRow row : rows) {
            if (row.matrixId() != matrixId) {
                throw new IllegalArgumentException(
                        "Row for matrix " + row.matrixId() + " passed to upsert of matrix " + matrixId);
            }
            String hash = hasher.hash(row);
            byKey.put(hash, new KeyedStatistic(hash, row));
        }
        List<KeyedStatistic> keyed = new ArrayList<>(byKey.values());
        int collapsed = rows.size() - keyed.size();
        if (collapsed > 0) {
            log.warn("Collapsed {} rows sharing a natural key for matrix {}; last value kept", collapsed, matrixId);
        }

        int batchSize = properties.getIngest().getBatchSize();
        long inserted = 0;
        long updated = 0;
        List<BatchCounts> batches = new ArrayList<>();
        for (int from = 0; from < keyed.size(); from += batchSize) {
            List<KeyedStatistic> batch = new ArrayList<>(keyed.subList(from, Math.min(from + batchSize, keyed.size())));
            // Stable ordering reduces lock-order deadlocks across concurrent jobs.
            batch.sort(Comparator.comparing(KeyedStatistic::naturalKeyHash));
            BatchCounts counts;
            try {
                counts = upsertWithRetry(matrixId, batch);
            } catch (MissingPartitionException ex) {
                log.error("Statistics partition for matrix {} disappeared during upsert", matrixId);
                throw ex;
            } catch (RuntimeException ex) {
                log.error("Failed to upsert statistics batch for matrix {} ({} rows)", matrixId, batch.size(), ex);
                throw ex;
            }
            batches.add(counts);
            inserted += counts.inserted();
            updated += counts.updated();
            log.debug(
                    "Upserted batch for matrix {}: inserted={} updated={}",
                    matrixId,
                    counts.inserted(),
                    counts.updated());
        }
        return new UpsertResult(inserted, updated, collapsed, batches);
    }

    /** Fails fast when the matrix has no statistics partition. */
    public void requirePartition(long matrixId) {
        if (!partitions.partitionExists(matrixId)) {
            log.error("No statistics partition for matrix {}; provisioning required before sync", matrixId);
            throw new MissingPartitionException(matrixId);
        }
    }

    /** Each attempt runs in a fresh transaction; a deadlock aborts the one it happened in. */
    private BatchCounts upsertWithRetry(long matrixId, List<KeyedStatistic> batch) {
        int attempts = 0;
        int maxAttempts = properties.getIngest().getDeadlockMaxAttempts();
        while (true) {
            attempts++;
            try {
                BatchCounts counts =
                        txTemplate.execute(status -> statistics.upsertBatch(matrixId, batch, clock.instant()));
                return counts == null ? new BatchCounts(0, 0) : counts;
            } catch (DataAccessException ex) {
                if (attempts >= maxAttempts || !SqlStates.hasState(ex, SqlStates.DEADLOCK)) {
                    throw ex;
                }
                long base = 50L << Math.min(attempts, 6); // capped exponential
                long jitter = ThreadLocalRandom.current().nextLong(base, base * 2);
                long backoffMs = Math.min(jitter, 5_000L);
                log.warn(
                        "Deadlock detected while upserting statistics for matrix {}. Retrying attempt {}/{} after {} ms",
                        matrixId,
                        attempts + 1,
                        maxAttempts,
                        backoffMs);
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ex;
                }
            }
        }
    }
}
