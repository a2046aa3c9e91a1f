package com.statgrid.core.model;

import java.time.LocalDate;

/**
 * Calendar period a statistic refers to. {@code quarter} is set only for quarterly periods and
 * {@code month} only for monthly ones.
 */
public record TimePeriod(
        long id,
        int year,
        Integer quarter,
        Integer month,
        Periodicity periodicity,
        String label,
        String labelEn,
        LocalDate periodStart,
        LocalDate periodEnd) {}
