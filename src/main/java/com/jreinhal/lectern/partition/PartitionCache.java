package com.jreinhal.lectern.partition;

import com.jreinhal.lectern.vector.PartitionHandle;
import java.util.function.Function;

/**
 * Process-local map of resolved partitions.
 */
public interface PartitionCache {

    /**
     * Atomic get-or-insert: for a given key {@code creator} runs at most once at a time,
     * and concurrent callers wait for and share its result. A creator that throws leaves
     * nothing cached.
     */
    PartitionHandle getOrCreate(String key, Function<String, PartitionHandle> creator);

    void invalidate(String key);
}
