package com.statgrid.service.core.statistic;

/**
 * No statistics partition exists for the matrix. Not retryable: the partition has to be provisioned
 * before the matrix can be synced.
 */
public class MissingPartitionException extends IllegalStateException {

    private final long matrixId;

    public MissingPartitionException(long matrixId) {
        this(matrixId, null);
    }

    public MissingPartitionException(long matrixId, Throwable cause) {
        super("No statistics partition for matrix " + matrixId + "; provision it before syncing", cause);
        this.matrixId = matrixId;
    }

    public long getMatrixId() {
        return matrixId;
    }
}
