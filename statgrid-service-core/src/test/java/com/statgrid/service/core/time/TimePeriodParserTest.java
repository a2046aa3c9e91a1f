package com.statgrid.service.core.time;

import static org.assertj.core.api.Assertions.assertThat;

import com.statgrid.core.model.Periodicity;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TimePeriodParserTest {

    @Test
    void parsesAnnualLabels() {
        assertThat(TimePeriodParser.parse("Anul 2023")).contains(ParsedTimePeriod.annual(2023));
        assertThat(TimePeriodParser.parse("2019")).contains(ParsedTimePeriod.annual(2019));
    }

    @Test
    void yearSpanUsesEndYearButBareRangeUsesStartYear() {
        assertThat(TimePeriodParser.parse("Anii 2020-2022")).contains(ParsedTimePeriod.annual(2022));
        assertThat(TimePeriodParser.parse("2015 - 2016")).contains(ParsedTimePeriod.annual(2015));
    }

    @Test
    void parsesQuarterLabels() {
        assertThat(TimePeriodParser.parse("Trimestrul II 2024")).contains(ParsedTimePeriod.quarterly(2024, 2));
        assertThat(TimePeriodParser.parse("Trimestrul IV 2023")).contains(ParsedTimePeriod.quarterly(2023, 4));
        assertThat(TimePeriodParser.parse("T3 2022")).contains(ParsedTimePeriod.quarterly(2022, 3));
    }

    @Test
    void parsesMonthLabelsWithDiacritics() {
        assertThat(TimePeriodParser.parse("Luna martie 2024")).contains(ParsedTimePeriod.monthly(2024, 3));
        assertThat(TimePeriodParser.parse("Luna Noiembrie 2020")).contains(ParsedTimePeriod.monthly(2020, 11));
        assertThat(TimePeriodParser.parse("Ian 2021")).contains(ParsedTimePeriod.monthly(2021, 1));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Total", "martie", "Luna Brumar 2020", "Xyz 2020", "", "Medii de rezidenta"})
    void rejectsNonPeriods(String label) {
        assertThat(TimePeriodParser.parse(label)).isEmpty();
    }

    @Test
    void computesBoundsAndEnglishLabels() {
        ParsedTimePeriod q1 = ParsedTimePeriod.quarterly(2024, 1);
        assertThat(q1.periodStart()).isEqualTo(LocalDate.of(2024, 1, 1));
        assertThat(q1.periodEnd()).isEqualTo(LocalDate.of(2024, 3, 31));
        assertThat(q1.englishLabel()).isEqualTo("Quarter 1 2024");

        ParsedTimePeriod feb = ParsedTimePeriod.monthly(2024, 2);
        assertThat(feb.periodEnd()).isEqualTo(LocalDate.of(2024, 2, 29));
        assertThat(feb.englishLabel()).isEqualTo("February 2024");
        assertThat(feb.periodicity()).isEqualTo(Periodicity.MONTHLY);

        assertThat(ParsedTimePeriod.annual(2023).englishLabel()).isEqualTo("Year 2023");
        assertThat(ParsedTimePeriod.annual(2023).periodEnd()).isEqualTo(LocalDate.of(2023, 12, 31));
    }
}
