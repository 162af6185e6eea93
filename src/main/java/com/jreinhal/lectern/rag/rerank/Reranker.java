package com.jreinhal.lectern.rag.rerank;

import com.jreinhal.lectern.constant.RagConstants;
import com.jreinhal.lectern.rag.retrieval.RetrievalCandidate;
import java.util.List;

/**
 * Second-pass ordering and truncation of retrieved candidates. Implementations must be
 * pure: the output depends only on the arguments.
 */
public interface Reranker {

    List<RetrievalCandidate> rerank(String query, List<RetrievalCandidate> candidates, int limit);

    default List<RetrievalCandidate> rerank(String query, List<RetrievalCandidate> candidates) {
        return this.rerank(query, candidates, RagConstants.DEFAULT_RERANK_LIMIT);
    }
}
