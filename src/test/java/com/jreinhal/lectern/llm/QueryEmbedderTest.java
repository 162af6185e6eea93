package com.jreinhal.lectern.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.lectern.exception.EmbeddingFailureException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.test.util.ReflectionTestUtils;

class QueryEmbedderTest {

    private EmbeddingModel embeddingModel;
    private ExecutorService executor;
    private QueryEmbedder embedder;

    @BeforeEach
    void setUp() {
        embeddingModel = mock(EmbeddingModel.class);
        executor = Executors.newFixedThreadPool(2);
        embedder = new QueryEmbedder(embeddingModel, Caffeine.newBuilder().maximumSize(100).<String, float[]>build(), executor);
        ReflectionTestUtils.setField(embedder, "timeoutSeconds", 5);
        ReflectionTestUtils.setField(embedder, "maxRetries", 2);
        ReflectionTestUtils.setField(embedder, "retryBackoffMs", 0L);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Transient failure is retried")
    void retriesTransientFailure() {
        when(embeddingModel.embed(anyString()))
                .thenThrow(new IllegalStateException("connection reset"))
                .thenReturn(new float[] {0.5f, 0.5f});

        assertArrayEquals(new float[] {0.5f, 0.5f}, embedder.embed("page text"));
        verify(embeddingModel, times(2)).embed("page text");
    }

    @Test
    @DisplayName("Empty vector counts as a failure")
    void emptyVectorFails() {
        when(embeddingModel.embed(anyString())).thenReturn(new float[0]);

        EmbeddingFailureException e = assertThrows(EmbeddingFailureException.class, () -> embedder.embed("page text"));

        assertThat(e.getMessage()).contains("3 attempts");
        verify(embeddingModel, times(3)).embed("page text");
    }

    @Test
    @DisplayName("Query vectors are cached on normalized text")
    void cachesQueryVectors() {
        when(embeddingModel.embed(anyString())).thenReturn(new float[] {1f, 0f});

        float[] first = embedder.embedQuery("What is the fee?");
        float[] second = embedder.embedQuery("  what is the FEE?  ");

        assertArrayEquals(first, second);
        verify(embeddingModel, times(1)).embed(anyString());
    }

    @Test
    void failedQueryIsNotCached() {
        when(embeddingModel.embed(anyString()))
                .thenReturn(new float[0], new float[0], new float[0])
                .thenReturn(new float[] {1f});

        assertThrows(EmbeddingFailureException.class, () -> embedder.embedQuery("fee"));
        assertArrayEquals(new float[] {1f}, embedder.embedQuery("fee"));
    }
}
