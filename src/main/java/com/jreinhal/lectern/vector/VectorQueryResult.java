package com.jreinhal.lectern.vector;

import java.util.List;
import java.util.Map;

/**
 * Parallel lists, nearest first.
 */
public record VectorQueryResult(List<String> ids, List<String> documents, List<Map<String, Object>> metadatas, List<Double> distances) {
    public static VectorQueryResult empty() {
        return new VectorQueryResult(List.of(), List.of(), List.of(), List.of());
    }

    public int size() {
        return this.ids.size();
    }
}
