package com.statgrid.service.core.checkpoint;

import java.time.Instant;

/** Per-matrix checkpoint aggregates. The sync bounds are null when no chunk has been synced. */
public record CheckpointStats(long chunkCount, long totalRows, Instant oldestSync, Instant newestSync) {

    public static CheckpointStats empty() {
        return new CheckpointStats(0, 0, null, null);
    }
}
