package com.jreinhal.lectern.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.lectern.vector.PartitionHandle;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LecternCacheConfig {

    @Bean
    public Cache<String, PartitionHandle> partitionHandleCache(
            @Value("${lectern.partition.cache-max-size:10000}") long maxSize) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterAccess(Duration.ofHours(6L))
            .build();
    }

    @Bean
    public Cache<String, float[]> queryEmbeddingCache(
            @Value("${lectern.embedding.cache-max-size:2000}") long maxSize) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(30L))
            .build();
    }
}
