package com.statgrid.service.core.resolve;

import java.util.Optional;

public interface LabelMappingRepository {

    Optional<LabelMapping> find(String labelNormalized, ContextType contextType, String contextHint);

    /**
     * Inserts the mapping unless a row with the same key already exists.
     *
     * @return true when this call wrote the row
     */
    boolean insertIfAbsent(LabelMapping mapping);

    /** Deletes the mappings first written while syncing the given matrix. */
    int deleteByMatrix(long matrixId);
}
