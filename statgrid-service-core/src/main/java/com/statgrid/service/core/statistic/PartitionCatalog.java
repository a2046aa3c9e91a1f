package com.statgrid.service.core.statistic;

/** Answers whether the statistics partition for a matrix has been provisioned. */
public interface PartitionCatalog {

    boolean partitionExists(long matrixId);
}
