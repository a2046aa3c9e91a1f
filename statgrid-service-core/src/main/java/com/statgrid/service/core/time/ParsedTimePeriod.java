package com.statgrid.service.core.time;

import com.statgrid.core.model.Periodicity;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;

/** Structured form of a period label before it is bound to a row id. */
public record ParsedTimePeriod(int year, Integer quarter, Integer month, Periodicity periodicity) {

    public static ParsedTimePeriod annual(int year) {
        return new ParsedTimePeriod(year, null, null, Periodicity.ANNUAL);
    }

    public static ParsedTimePeriod quarterly(int year, int quarter) {
        return new ParsedTimePeriod(year, quarter, null, Periodicity.QUARTERLY);
    }

    public static ParsedTimePeriod monthly(int year, int month) {
        return new ParsedTimePeriod(year, null, month, Periodicity.MONTHLY);
    }

    public LocalDate periodStart() {
        return switch (periodicity) {
            case ANNUAL -> LocalDate.of(year, 1, 1);
            case QUARTERLY -> LocalDate.of(year, (quarter - 1) * 3 + 1, 1);
            case MONTHLY -> LocalDate.of(year, month, 1);
        };
    }

    public LocalDate periodEnd() {
        return switch (periodicity) {
            case ANNUAL -> LocalDate.of(year, 12, 31);
            case QUARTERLY -> periodStart().plusMonths(3).minusDays(1);
            case MONTHLY -> periodStart().plusMonths(1).minusDays(1);
        };
    }

    public String englishLabel() {
        return switch (periodicity) {
            case ANNUAL -> "Year " + year;
            case QUARTERLY -> "Quarter " + quarter + " " + year;
            case MONTHLY -> Month.of(month).getDisplayName(TextStyle.FULL, Locale.ENGLISH) + " " + year;
        };
    }
}
