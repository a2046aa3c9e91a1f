package com.statgrid.service.core.ingest;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ValueParserTest {

    @Test
    void parsesDecimalCommaAndDot() {
        assertThat(ValueParser.parse("12,5").value()).isEqualTo(12.5);
        assertThat(ValueParser.parse(" 1024.75 ").value()).isEqualTo(1024.75);
        assertThat(ValueParser.parse("-3").value()).isEqualTo(-3.0);
    }

    @ParameterizedTest
    @ValueSource(strings = {":", "-", "*", "<0.5"})
    void markersBecomeStatusWithoutValue(String marker) {
        ValueParser.ParsedValue parsed = ValueParser.parse(marker);

        assertThat(parsed.value()).isNull();
        assertThat(parsed.status()).isEqualTo(marker);
    }

    @Test
    void blankAndGarbageCarryNothing() {
        assertThat(ValueParser.parse(null)).isEqualTo(new ValueParser.ParsedValue(null, null));
        assertThat(ValueParser.parse("   ")).isEqualTo(new ValueParser.ParsedValue(null, null));
        assertThat(ValueParser.parse("n/a")).isEqualTo(new ValueParser.ParsedValue(null, null));
    }
}
