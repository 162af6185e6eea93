package com.jreinhal.lectern.vector;

/**
 * Resolved reference to a partition in the vector index.
 */
public record PartitionHandle(String partitionId, String collectionName) {
}
