package com.statgrid.service.core.support;

import com.statgrid.core.label.LabelNormalizer;

/**
 * Generated entity codes: upper-case ASCII, spaces as underscores, other symbols dropped, max 50 chars.
 * A label with no letters or digits gets a code derived from its hash instead.
 */
public final class Codes {

    public static final int MAX_LENGTH = 50;

    private Codes() {}

    static final String HASHED_PREFIX = "H_";
    private static final int HASHED_HEX_CHARS = 16;

    public static String fromLabel(String label) {
        String normalized = LabelNormalizer.normalize(label);
        String code = normalized.replace(' ', '_').replaceAll("[^0-9A-Z_]", "");
        if (code.replace("_", "").isEmpty()) {
            return HASHED_PREFIX + Sha256.hex(normalized).substring(0, HASHED_HEX_CHARS);
        }
        return code.length() > MAX_LENGTH ? code.substring(0, MAX_LENGTH) : code;
    }
}
