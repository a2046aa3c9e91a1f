package com.statgrid.core.label;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Canonical form of free-text dimension labels.
 *
 * <p>The output is used as a durable lookup key, so the transformation must stay identical across
 * releases: upper-case, NFD decomposition, combining marks U+0300..U+036F removed, whitespace runs
 * collapsed to a single space, trimmed.
 */
public final class LabelNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("[\\u0300-\\u036F]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern WHITESPACE_OR_HYPHEN = Pattern.compile("[\\s-]+");

    private LabelNormalizer() {}

    public static String normalize(String label) {
        Objects.requireNonNull(label, "label");
        String upper = label.toUpperCase(Locale.ROOT);
        String decomposed = Normalizer.normalize(upper, Normalizer.Form.NFD);
        String stripped = COMBINING_MARKS.matcher(decomposed).replaceAll("");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /** Same as {@link #normalize(String)} but hyphens are folded together with whitespace. */
    public static String normalizeFoldingHyphens(String label) {
        String normalized = normalize(label);
        return WHITESPACE_OR_HYPHEN.matcher(normalized).replaceAll(" ").trim();
    }
}
