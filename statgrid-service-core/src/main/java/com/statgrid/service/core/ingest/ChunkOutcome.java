package com.statgrid.service.core.ingest;

public record ChunkOutcome(
        String chunkHash,
        Status status,
        int rowsFetched,
        int rowsSkipped,
        int rowsCollapsed,
        int unresolvedLabels,
        long inserted,
        long updated,
        String error) {

    public enum Status {
        SYNCED,
        FRESH,
        FETCH_FAILED
    }

    static ChunkOutcome fresh(String chunkHash) {
        return new ChunkOutcome(chunkHash, Status.FRESH, 0, 0, 0, 0, 0, 0, null);
    }

    static ChunkOutcome fetchFailed(String chunkHash, String error) {
        return new ChunkOutcome(chunkHash, Status.FETCH_FAILED, 0, 0, 0, 0, 0, 0, error);
    }

    public long written() {
        return inserted + updated;
    }
}
