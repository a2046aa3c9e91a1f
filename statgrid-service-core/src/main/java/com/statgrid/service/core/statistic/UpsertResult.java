package com.statgrid.service.core.statistic;

import java.util.List;

/**
 * @param collapsed input rows dropped because a later row in the same call had the same natural key
 */
public record UpsertResult(long inserted, long updated, int collapsed, List<BatchCounts> batches) {

    public static final UpsertResult EMPTY = new UpsertResult(0, 0, 0, List.of());

    public UpsertResult {
        batches = List.copyOf(batches);
    }

    public long written() {
        return inserted + updated;
    }
}
