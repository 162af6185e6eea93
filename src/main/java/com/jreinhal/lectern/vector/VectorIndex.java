package com.jreinhal.lectern.vector;

import java.util.List;
import java.util.Map;

/**
 * Partitioned nearest-neighbour index. Filters are metadata equality maps; a
 * {@link java.util.Collection} value matches any of its elements.
 */
public interface VectorIndex {

    /**
     * Idempotent: concurrent calls for the same partition resolve to the same handle.
     */
    PartitionHandle createOrGet(String partitionId);

    void add(PartitionHandle handle, List<String> ids, List<float[]> vectors, List<Map<String, Object>> metadata, List<String> documents);

    default VectorQueryResult query(PartitionHandle handle, float[] vector, int k) {
        return this.query(handle, vector, k, Map.of());
    }

    VectorQueryResult query(PartitionHandle handle, float[] vector, int k, Map<String, Object> filter);

    long deleteByFilter(PartitionHandle handle, Map<String, Object> filter);

    void deleteCollection(String partitionId);

    default long count(PartitionHandle handle) {
        return this.count(handle, Map.of());
    }

    long count(PartitionHandle handle, Map<String, Object> filter);

    List<String> distinctValues(PartitionHandle handle, String metadataKey);
}
