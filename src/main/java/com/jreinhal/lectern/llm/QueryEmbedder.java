package com.jreinhal.lectern.llm;

import com.github.benmanes.caffeine.cache.Cache;
import com.jreinhal.lectern.exception.EmbeddingFailureException;
import com.jreinhal.lectern.util.CorrelatedTasks;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Embedding calls with a per-attempt timeout, retry with exponential backoff, and a
 * cache for query vectors.
 */
@Component
public class QueryEmbedder {
    private static final Logger log = LoggerFactory.getLogger(QueryEmbedder.class);
    private final EmbeddingModel embeddingModel;
    private final Cache<String, float[]> queryEmbeddingCache;
    private final ExecutorService externalCallExecutor;
    @Value("${lectern.timeouts.embedding-seconds:20}")
    private int timeoutSeconds;
    @Value("${lectern.embedding.max-retries:2}")
    private int maxRetries;
    @Value("${lectern.embedding.retry-backoff-ms:500}")
    private long retryBackoffMs;

    public QueryEmbedder(EmbeddingModel embeddingModel, @Qualifier("queryEmbeddingCache") Cache<String, float[]> queryEmbeddingCache, @Qualifier("externalCallExecutor") ExecutorService externalCallExecutor) {
        this.embeddingModel = embeddingModel;
        this.queryEmbeddingCache = queryEmbeddingCache;
        this.externalCallExecutor = externalCallExecutor;
    }

    /**
     * Query embedding, served from cache when the same normalized text was embedded recently.
     */
    public float[] embedQuery(String text) {
        String key = text.trim().toLowerCase(Locale.ROOT);
        float[] cached = this.queryEmbeddingCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        float[] vector = this.embed(text);
        this.queryEmbeddingCache.put(key, vector);
        return vector;
    }

    /**
     * @throws EmbeddingFailureException once all attempts have failed
     */
    public float[] embed(String text) {
        RuntimeException last = null;
        for (int attempt = 0; attempt <= this.maxRetries; ++attempt) {
            if (attempt > 0) {
                this.backoff(attempt);
            }
            try {
                return this.embedOnce(text);
            }
            catch (EmbeddingFailureException e) {
                last = e;
                log.warn("Embedding attempt {}/{} failed: {}", attempt + 1, this.maxRetries + 1, e.getMessage());
            }
        }
        throw new EmbeddingFailureException("Embedding failed after " + (this.maxRetries + 1) + " attempts", last);
    }

    private float[] embedOnce(String text) {
        float[] vector;
        try {
            vector = CompletableFuture.supplyAsync(CorrelatedTasks.wrap(() -> this.embeddingModel.embed(text)), this.externalCallExecutor)
                    .get(this.timeoutSeconds, TimeUnit.SECONDS);
        }
        catch (TimeoutException e) {
            throw new EmbeddingFailureException("Embedding timed out after " + this.timeoutSeconds + "s", e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingFailureException("Embedding interrupted", e);
        }
        catch (ExecutionException e) {
            throw new EmbeddingFailureException("Embedding call failed", e.getCause() != null ? e.getCause() : e);
        }
        if (vector == null || vector.length == 0) {
            throw new EmbeddingFailureException("Embedding model returned an empty vector", null);
        }
        return vector;
    }

    private void backoff(int attempt) {
        long delay = this.retryBackoffMs * (1L << (attempt - 1));
        if (delay <= 0L) {
            return;
        }
        try {
            Thread.sleep(delay);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingFailureException("Interrupted while backing off", e);
        }
    }
}
