package com.statgrid.service.core.resolve;

import java.util.Objects;

/**
 * One label to resolve.
 *
 * @param contextHint optional disambiguator; for classifications this is the type id
 * @param matrixId matrix on whose behalf the label is resolved, recorded with a new mapping
 * @param placement tree placement used only when a classification value is created
 */
public record LabelRequest(
        ContextType contextType,
        String label,
        String alternativeLabel,
        String contextHint,
        Long matrixId,
        ClassificationPlacement placement) {

    public LabelRequest {
        Objects.requireNonNull(contextType, "contextType");
        Objects.requireNonNull(label, "label");
        placement = placement == null ? ClassificationPlacement.ROOT : placement;
    }

    public static LabelRequest of(ContextType contextType, String label) {
        return new LabelRequest(contextType, label, null, null, null, null);
    }

    /** Hint as stored in the mapping key; the empty string means no hint. */
    public String contextHintKey() {
        return contextHint == null ? "" : contextHint;
    }

    public LabelRequest forMatrix(Long matrix) {
        return new LabelRequest(contextType, label, alternativeLabel, contextHint, matrix, placement);
    }
}
