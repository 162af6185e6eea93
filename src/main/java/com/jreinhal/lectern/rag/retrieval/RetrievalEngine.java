package com.jreinhal.lectern.rag.retrieval;

import com.jreinhal.lectern.constant.RagConstants;
import com.jreinhal.lectern.exception.VectorSearchException;
import com.jreinhal.lectern.llm.QueryEmbedder;
import com.jreinhal.lectern.model.DocumentChunk;
import com.jreinhal.lectern.util.LogSanitizer;
import com.jreinhal.lectern.vector.PartitionHandle;
import com.jreinhal.lectern.vector.VectorIndex;
import com.jreinhal.lectern.vector.VectorQueryResult;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Embeds a query, searches one partition and keeps the candidates at or above the
 * similarity threshold, best first. An empty result is a valid outcome, not an error;
 * embedding and index failures propagate as typed exceptions for the fallback chain.
 */
@Service
public class RetrievalEngine {
    private static final Logger log = LoggerFactory.getLogger(RetrievalEngine.class);
    private final QueryEmbedder queryEmbedder;
    private final VectorIndex vectorIndex;
    @Value("${lectern.retrieval.top-k:" + RagConstants.DEFAULT_TOP_K + "}")
    private int defaultTopK;
    @Value("${lectern.retrieval.similarity-threshold:" + RagConstants.DEFAULT_SIMILARITY_THRESHOLD + "}")
    private double similarityThreshold;

    public RetrievalEngine(QueryEmbedder queryEmbedder, VectorIndex vectorIndex) {
        this.queryEmbedder = queryEmbedder;
        this.vectorIndex = vectorIndex;
    }

    @PostConstruct
    public void init() {
        log.info("Retrieval engine initialized (topK={}, threshold={})", this.defaultTopK, this.similarityThreshold);
    }

    public List<RetrievalCandidate> retrieve(String query, String partitionId, int topK) {
        return this.retrieve(query, this.vectorIndex.createOrGet(partitionId), topK, Map.of());
    }

    public List<RetrievalCandidate> retrieve(String query, PartitionHandle partition, int topK) {
        return this.retrieve(query, partition, topK, Map.of());
    }

    public List<RetrievalCandidate> retrieve(String query, PartitionHandle partition, int topK, Map<String, Object> filter) {
        float[] vector = this.queryEmbedder.embedQuery(query);
        return this.search(vector, partition, topK, filter);
    }

    /**
     * Retrieval with dominant-file refinement: when more than
     * {@link RagConstants#DOMINANT_FILE_RATIO} of the candidates come from one file, the
     * search is repeated inside that file so its other relevant pages surface too.
     */
    public List<RetrievalCandidate> retrieveFocused(String query, PartitionHandle partition, int topK, Map<String, Object> filter) {
        float[] vector = this.queryEmbedder.embedQuery(query);
        List<RetrievalCandidate> candidates = this.search(vector, partition, topK, filter);
        if (candidates.size() < 2 || filter.containsKey(DocumentChunk.FILE_ID_KEY)) {
            return candidates;
        }
        Map<String, Long> perFile = candidates.stream()
                .collect(Collectors.groupingBy(c -> c.chunk().fileId(), Collectors.counting()));
        Map.Entry<String, Long> top = perFile.entrySet().stream().max(Map.Entry.comparingByValue()).orElseThrow();
        if (perFile.size() < 2 || (double) top.getValue() / candidates.size() <= RagConstants.DOMINANT_FILE_RATIO) {
            return candidates;
        }
        Map<String, Object> focused = new HashMap<>(filter);
        focused.put(DocumentChunk.FILE_ID_KEY, top.getKey());
        List<RetrievalCandidate> refined = this.search(vector, partition, topK, focused);
        log.debug("Refined retrieval to dominant file {} ({} -> {} candidates)", LogSanitizer.sanitize(top.getKey()), candidates.size(), refined.size());
        return refined.isEmpty() ? candidates : refined;
    }

    public int defaultTopK() {
        return this.defaultTopK;
    }

    public double similarityThreshold() {
        return this.similarityThreshold;
    }

    private List<RetrievalCandidate> search(float[] vector, PartitionHandle partition, int topK, Map<String, Object> filter) {
        VectorQueryResult result;
        try {
            result = this.vectorIndex.query(partition, vector, topK, filter);
        }
        catch (VectorSearchException e) {
            throw e;
        }
        catch (RuntimeException e) {
            throw new VectorSearchException(partition.partitionId(), "Vector search failed", e);
        }
        List<RetrievalCandidate> candidates = new ArrayList<>(result.size());
        for (int i = 0; i < result.size(); ++i) {
            DocumentChunk chunk = DocumentChunk.fromIndex(result.ids().get(i), result.documents().get(i), result.metadatas().get(i));
            RetrievalCandidate candidate = RetrievalCandidate.of(chunk, result.distances().get(i));
            if (candidate.score() >= this.similarityThreshold) {
                candidates.add(candidate);
            }
        }
        candidates.sort(Comparator.comparingDouble(RetrievalCandidate::score).reversed());
        log.debug("Partition {}: {} hits, {} above threshold {}", partition.partitionId(), result.size(), candidates.size(), this.similarityThreshold);
        return candidates;
    }
}
