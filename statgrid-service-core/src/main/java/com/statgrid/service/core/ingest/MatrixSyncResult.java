package com.statgrid.service.core.ingest;

import java.util.List;

/**
 * @param cancelled true when the run stopped before visiting every requested chunk
 */
public record MatrixSyncResult(long matrixId, int requestedChunks, List<ChunkOutcome> chunks, boolean cancelled) {

    public MatrixSyncResult {
        chunks = List.copyOf(chunks);
    }

    /** Every requested chunk ended synced or already fresh. */
    public boolean complete() {
        return !cancelled
                && chunks.size() == requestedChunks
                && chunks.stream().noneMatch(c -> c.status() == ChunkOutcome.Status.FETCH_FAILED);
    }

    public long count(ChunkOutcome.Status status) {
        return chunks.stream().filter(c -> c.status() == status).count();
    }

    public long rowsWritten() {
        return chunks.stream().mapToLong(ChunkOutcome::written).sum();
    }
}
