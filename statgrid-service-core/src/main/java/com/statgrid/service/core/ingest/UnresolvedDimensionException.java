package com.statgrid.service.core.ingest;

import com.statgrid.service.core.resolve.ContextType;

/** Raised under {@link UnresolvedLabelPolicy#FAIL_CHUNK} for the first unresolved label of a chunk. */
public class UnresolvedDimensionException extends IllegalStateException {

    private final long matrixId;
    private final ContextType contextType;
    private final String label;

    public UnresolvedDimensionException(long matrixId, ContextType contextType, String label) {
        super("Unresolved " + contextType + " label '" + label + "' in matrix " + matrixId);
        this.matrixId = matrixId;
        this.contextType = contextType;
        this.label = label;
    }

    public long getMatrixId() {
        return matrixId;
    }

    public ContextType getContextType() {
        return contextType;
    }

    public String getLabel() {
        return label;
    }
}
