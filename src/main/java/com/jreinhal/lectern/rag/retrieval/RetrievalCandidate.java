package com.jreinhal.lectern.rag.retrieval;

import com.jreinhal.lectern.model.DocumentChunk;

/**
 * A chunk returned by the vector index, with {@code score = 1 - distance}.
 */
public record RetrievalCandidate(DocumentChunk chunk, double distance, double score) {

    public static RetrievalCandidate of(DocumentChunk chunk, double distance) {
        return new RetrievalCandidate(chunk, distance, 1.0 - distance);
    }
}
