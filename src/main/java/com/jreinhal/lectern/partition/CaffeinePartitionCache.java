package com.jreinhal.lectern.partition;

import com.github.benmanes.caffeine.cache.Cache;
import com.jreinhal.lectern.vector.PartitionHandle;
import java.util.function.Function;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class CaffeinePartitionCache implements PartitionCache {
    private final Cache<String, PartitionHandle> cache;

    public CaffeinePartitionCache(@Qualifier("partitionHandleCache") Cache<String, PartitionHandle> cache) {
        this.cache = cache;
    }

    @Override
    public PartitionHandle getOrCreate(String key, Function<String, PartitionHandle> creator) {
        return this.cache.get(key, creator);
    }

    @Override
    public void invalidate(String key) {
        this.cache.invalidate(key);
    }
}
