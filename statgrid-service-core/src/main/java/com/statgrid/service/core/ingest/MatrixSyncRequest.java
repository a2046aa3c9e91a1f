package com.statgrid.service.core.ingest;

import com.statgrid.service.core.checkpoint.ResyncOptions;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * @param chunkSignatures chunks to sync, in order
 * @param dimensions one binding per label column of the fetched rows
 * @param resync null to use the configured max chunk age
 * @param cancelled checked before each chunk; null means never cancelled
 */
public record MatrixSyncRequest(
        long matrixId,
        List<String> chunkSignatures,
        List<DimensionBinding> dimensions,
        ResyncOptions resync,
        BooleanSupplier cancelled) {

    public MatrixSyncRequest {
        chunkSignatures = List.copyOf(chunkSignatures);
        dimensions = List.copyOf(dimensions);
        cancelled = Objects.requireNonNullElse(cancelled, () -> false);
    }

    public static MatrixSyncRequest of(long matrixId, List<String> chunkSignatures, List<DimensionBinding> dimensions) {
        return new MatrixSyncRequest(matrixId, chunkSignatures, dimensions, null, null);
    }
}
