package com.statgrid.service.core.ingest;

import java.util.List;

/** Fetch collaborator: returns the raw rows of one chunk of a matrix. */
@FunctionalInterface
public interface ChunkSource {

    /**
     * @throws ChunkFetchException when the chunk could not be fetched
     */
    List<RawRow> fetch(long matrixId, String chunkSignature);
}
