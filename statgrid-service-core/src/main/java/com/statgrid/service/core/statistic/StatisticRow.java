package com.statgrid.service.core.statistic;

import java.util.List;

/**
 * A resolved fact row ready to be written. Dimension ids are null when the label did not resolve.
 *
 * @param valueStatus source marker for missing or suppressed values ({@code :}, {@code -}, {@code *},
 *     {@code <x}), null for plain numbers
 */
public record StatisticRow(
        long matrixId,
        Long territoryId,
        Long timePeriodId,
        Long unitId,
        List<Long> classificationValueIds,
        Double value,
        String valueStatus,
        String sourceChunkHash) {

    public StatisticRow {
        classificationValueIds = classificationValueIds == null ? List.of() : List.copyOf(classificationValueIds);
    }
}
