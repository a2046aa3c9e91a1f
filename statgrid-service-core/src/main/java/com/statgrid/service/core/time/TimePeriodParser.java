package com.statgrid.service.core.time;

import com.statgrid.core.label.LabelNormalizer;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses source period labels such as {@code Anul 2023}, {@code Trimestrul II 2024},
 * {@code Luna martie 2024}, {@code T3 2022}, {@code Ian 2021} or year ranges.
 */
public final class TimePeriodParser {

    private static final Pattern YEAR_SPAN = Pattern.compile("^ANI+I?\\s+(\\d{4})\\s*[-–]\\s*(\\d{4})$");
    private static final Pattern YEAR_WORD = Pattern.compile("ANUL\\s+(\\d{4})");
    private static final Pattern QUARTER_WORD = Pattern.compile("TRIMESTRUL\\s+(IV|I{1,3})\\s+(\\d{4})");
    private static final Pattern MONTH_WORD = Pattern.compile("LUNA\\s+(\\p{L}+)\\s+(\\d{4})");
    private static final Pattern BARE_YEAR = Pattern.compile("^(\\d{4})$");
    private static final Pattern QUARTER_SHORT = Pattern.compile("^T([1-4])\\s+(\\d{4})$");
    private static final Pattern MONTH_SHORT = Pattern.compile("^(\\p{L}{3})\\s+(\\d{4})$");
    private static final Pattern YEAR_RANGE = Pattern.compile("^(\\d{4})\\s*[-–]\\s*\\d{4}$");

    private static final Map<String, Integer> ROMAN_QUARTERS = Map.of("I", 1, "II", 2, "III", 3, "IV", 4);

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("IANUARIE", 1),
            Map.entry("FEBRUARIE", 2),
            Map.entry("MARTIE", 3),
            Map.entry("APRILIE", 4),
            Map.entry("MAI", 5),
            Map.entry("IUNIE", 6),
            Map.entry("IULIE", 7),
            Map.entry("AUGUST", 8),
            Map.entry("SEPTEMBRIE", 9),
            Map.entry("OCTOMBRIE", 10),
            Map.entry("NOIEMBRIE", 11),
            Map.entry("DECEMBRIE", 12));

    private static final Map<String, Integer> SHORT_MONTHS = Map.ofEntries(
            Map.entry("IAN", 1),
            Map.entry("FEB", 2),
            Map.entry("MAR", 3),
            Map.entry("APR", 4),
            Map.entry("MAI", 5),
            Map.entry("IUN", 6),
            Map.entry("IUL", 7),
            Map.entry("AUG", 8),
            Map.entry("SEP", 9),
            Map.entry("OCT", 10),
            Map.entry("NOI", 11),
            Map.entry("DEC", 12));

    private TimePeriodParser() {}

    public static Optional<ParsedTimePeriod> parse(String label) {
        String text = LabelNormalizer.normalize(label);
        // A bare month or a total column is a dimension option, not a period.
        if (text.isEmpty() || text.equals("TOTAL") || MONTHS.containsKey(text)) {
            return Optional.empty();
        }

        Matcher m = YEAR_SPAN.matcher(text);
        if (m.matches()) {
            return Optional.of(ParsedTimePeriod.annual(Integer.parseInt(m.group(2))));
        }
        m = YEAR_WORD.matcher(text);
        if (m.find()) {
            return Optional.of(ParsedTimePeriod.annual(Integer.parseInt(m.group(1))));
        }
        m = QUARTER_WORD.matcher(text);
        if (m.find()) {
            return Optional.of(ParsedTimePeriod.quarterly(
                    Integer.parseInt(m.group(2)), ROMAN_QUARTERS.get(m.group(1))));
        }
        m = MONTH_WORD.matcher(text);
        if (m.find() && MONTHS.containsKey(m.group(1))) {
            return Optional.of(ParsedTimePeriod.monthly(Integer.parseInt(m.group(2)), MONTHS.get(m.group(1))));
        }
        m = BARE_YEAR.matcher(text);
        if (m.matches()) {
            return Optional.of(ParsedTimePeriod.annual(Integer.parseInt(m.group(1))));
        }
        m = QUARTER_SHORT.matcher(text);
        if (m.matches()) {
            return Optional.of(
                    ParsedTimePeriod.quarterly(Integer.parseInt(m.group(2)), Integer.parseInt(m.group(1))));
        }
        m = MONTH_SHORT.matcher(text);
        if (m.matches() && SHORT_MONTHS.containsKey(m.group(1))) {
            return Optional.of(
                    ParsedTimePeriod.monthly(Integer.parseInt(m.group(2)), SHORT_MONTHS.get(m.group(1))));
        }
        m = YEAR_RANGE.matcher(text);
        if (m.matches()) {
            return Optional.of(ParsedTimePeriod.annual(Integer.parseInt(m.group(1))));
        }
        return Optional.empty();
    }
}
