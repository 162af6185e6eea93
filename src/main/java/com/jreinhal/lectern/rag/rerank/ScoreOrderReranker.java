package com.jreinhal.lectern.rag.rerank;

import com.jreinhal.lectern.rag.retrieval.RetrievalCandidate;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Keeps the vector ranking: sort by score, take the first {@code limit}.
 */
public class ScoreOrderReranker implements Reranker {

    @Override
    public List<RetrievalCandidate> rerank(String query, List<RetrievalCandidate> candidates, int limit) {
        if (candidates == null || candidates.isEmpty() || limit <= 0) {
            return List.of();
        }
        return candidates.stream()
                .sorted(Comparator.comparingDouble(RetrievalCandidate::score).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }
}
