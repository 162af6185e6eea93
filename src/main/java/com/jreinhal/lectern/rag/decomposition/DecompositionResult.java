package com.jreinhal.lectern.rag.decomposition;

import com.jreinhal.lectern.model.SourceCitation;
import java.util.List;

/**
 * @param answer    synthesized answer, or null when no sub-query produced usable evidence
 * @param citations union of sub-query citations, deduplicated and capped
 */
public record DecompositionResult(String answer, List<SubQuery> subQueries, List<SourceCitation> citations) {

    public long count(SubQuery.Status status) {
        return this.subQueries.stream().filter(s -> s.status() == status).count();
    }

    public boolean allFailed() {
        return !this.subQueries.isEmpty() && this.count(SubQuery.Status.FAILED) == this.subQueries.size();
    }

    public boolean hasEvidence() {
        return this.count(SubQuery.Status.ANSWERED) > 0;
    }
}
