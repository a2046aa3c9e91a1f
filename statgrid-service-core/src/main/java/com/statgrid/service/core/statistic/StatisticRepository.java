package com.statgrid.service.core.statistic;

import java.time.Instant;
import java.util.List;

public interface StatisticRepository {

    /**
     * Inserts or updates one batch of rows of a single matrix. Hashes within the batch must be
     * distinct.
     *
     * @throws MissingPartitionException when the matrix has no partition
     */
    BatchCounts upsertBatch(long matrixId, List<KeyedStatistic> batch, Instant now);
}
