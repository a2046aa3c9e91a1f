package com.statgrid.service.core.ingest;

import java.util.Set;

/** Parses raw cell text into a number or a status marker. */
final class ValueParser {

    private static final Set<String> STATUS_MARKERS = Set.of(":", "-", "*");

    record ParsedValue(Double value, String status) {}

    private static final ParsedValue EMPTY = new ParsedValue(null, null);

    private ValueParser() {}

    static ParsedValue parse(String raw) {
        if (raw == null) {
            return EMPTY;
        }
        String text = raw.trim();
        if (text.isEmpty()) {
            return EMPTY;
        }
        if (STATUS_MARKERS.contains(text) || text.startsWith("<")) {
            return new ParsedValue(null, text);
        }
        try {
            return new ParsedValue(Double.parseDouble(text.replace(',', '.')), null);
        } catch (NumberFormatException ex) {
            return EMPTY;
        }
    }
}
