package com.jreinhal.lectern.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.jreinhal.lectern.exception.VectorSearchException;
import com.jreinhal.lectern.llm.QueryEmbedder;
import com.jreinhal.lectern.model.DocumentChunk;
import com.jreinhal.lectern.vector.PartitionHandle;
import com.jreinhal.lectern.vector.VectorIndex;
import com.jreinhal.lectern.vector.VectorQueryResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class RetrievalEngineTest {

    private static final PartitionHandle PARTITION = new PartitionHandle("chat_u_s_abc", "chat_u_s_abc");

    private QueryEmbedder queryEmbedder;
    private VectorIndex vectorIndex;
    private RetrievalEngine engine;

    @BeforeEach
    void setUp() {
        queryEmbedder = mock(QueryEmbedder.class);
        vectorIndex = mock(VectorIndex.class);
        when(queryEmbedder.embedQuery(anyString())).thenReturn(new float[] {0.1f, 0.2f});
        engine = new RetrievalEngine(queryEmbedder, vectorIndex);
        ReflectionTestUtils.setField(engine, "defaultTopK", 8);
        ReflectionTestUtils.setField(engine, "similarityThreshold", 0.4);
    }

    @Test
    void dropsCandidatesBelowThresholdAndSortsByScore() {
        when(vectorIndex.query(eq(PARTITION), any(float[].class), eq(8), anyMap()))
                .thenReturn(result(hit("f1", 1, 0.5), hit("f1", 2, 0.1), hit("f2", 1, 0.7), hit("f2", 2, 0.3)));

        List<RetrievalCandidate> candidates = engine.retrieve("query", PARTITION, 8);

        assertThat(candidates).extracting(RetrievalCandidate::score)
                .containsExactly(0.9, 0.7, 0.5);
        assertThat(candidates).allMatch(c -> c.score() >= 0.4);
    }

    @Test
    void thresholdIsInclusive() {
        when(vectorIndex.query(eq(PARTITION), any(float[].class), anyInt(), anyMap()))
                .thenReturn(result(hit("f1", 1, 0.6)));

        assertThat(engine.retrieve("query", PARTITION, 8)).hasSize(1);
    }

    @Test
    void emptyPartitionYieldsNoCandidates() {
        when(vectorIndex.query(eq(PARTITION), any(float[].class), anyInt(), anyMap())).thenReturn(VectorQueryResult.empty());

        assertThat(engine.retrieve("query", PARTITION, 8)).isEmpty();
    }

    @Test
    void indexFailureBecomesVectorSearchException() {
        when(vectorIndex.query(eq(PARTITION), any(float[].class), anyInt(), anyMap()))
                .thenThrow(new IllegalStateException("socket closed"));

        assertThatThrownBy(() -> engine.retrieve("query", PARTITION, 8))
                .isInstanceOf(VectorSearchException.class);
    }

    @Test
    void chunkMetadataIsMapped() {
        when(vectorIndex.query(eq(PARTITION), any(float[].class), anyInt(), anyMap()))
                .thenReturn(result(hit("file-9", 4, 0.2)));

        DocumentChunk chunk = engine.retrieve("query", PARTITION, 8).get(0).chunk();

        assertThat(chunk.fileId()).isEqualTo("file-9");
        assertThat(chunk.fileName()).isEqualTo("file-9.pdf");
        assertThat(chunk.pageNumber()).isEqualTo(4);
    }

    @Test
    void focusesOnDominantFile() {
        when(vectorIndex.query(eq(PARTITION), any(float[].class), eq(8), argThat(f -> f == null || f.isEmpty())))
                .thenReturn(result(hit("a", 1, 0.1), hit("a", 2, 0.2), hit("a", 3, 0.3), hit("b", 1, 0.35)));
        when(vectorIndex.query(eq(PARTITION), any(float[].class), eq(8), argThat(f -> f != null && "a".equals(f.get(DocumentChunk.FILE_ID_KEY)))))
                .thenReturn(result(hit("a", 1, 0.1), hit("a", 2, 0.2), hit("a", 3, 0.3), hit("a", 7, 0.4)));

        List<RetrievalCandidate> candidates = engine.retrieveFocused("query", PARTITION, 8, Map.of());

        assertThat(candidates).extracting(c -> c.chunk().fileId()).containsOnly("a");
        assertThat(candidates).extracting(c -> c.chunk().pageNumber()).contains(7);
    }

    @Test
    void noRefinementWithoutDominantFile() {
        when(vectorIndex.query(eq(PARTITION), any(float[].class), eq(8), anyMap()))
                .thenReturn(result(hit("a", 1, 0.1), hit("b", 1, 0.2)));

        List<RetrievalCandidate> candidates = engine.retrieveFocused("query", PARTITION, 8, Map.of());

        assertThat(candidates).hasSize(2);
        verify(vectorIndex, never()).query(eq(PARTITION), any(float[].class), eq(8),
                argThat(f -> f != null && f.containsKey(DocumentChunk.FILE_ID_KEY)));
    }

    private static Object[] hit(String fileId, int page, double distance) {
        return new Object[] {fileId, page, distance};
    }

    private static VectorQueryResult result(Object[]... hits) {
        List<String> ids = new ArrayList<>();
        List<String> documents = new ArrayList<>();
        List<Map<String, Object>> metadatas = new ArrayList<>();
        List<Double> distances = new ArrayList<>();
        for (Object[] hit : hits) {
            String fileId = (String) hit[0];
            int page = (Integer) hit[1];
            ids.add(DocumentChunk.chunkId(fileId, page));
            documents.add("content of " + fileId + " page " + page);
            metadatas.add(Map.of(DocumentChunk.FILE_ID_KEY, fileId, DocumentChunk.FILE_NAME_KEY, fileId + ".pdf", DocumentChunk.PAGE_NUMBER_KEY, page));
            distances.add((Double) hit[2]);
        }
        return new VectorQueryResult(ids, documents, metadatas, distances);
    }
}
