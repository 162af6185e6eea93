package com.jreinhal.lectern.rag.decomposition;

import com.jreinhal.lectern.model.SourceCitation;
import java.util.List;

/**
 * One independently retrievable part of a compound question.
 *
 * @param targetPages pages the part explicitly names; empty means the whole partition
 * @param subAnswer   null until executed; a placeholder text when nothing usable came back
 */
public record SubQuery(String text, List<Integer> targetPages, String subAnswer, List<SourceCitation> citations, Status status) {

    public enum Status {
        PENDING,
        ANSWERED,
        EMPTY,
        FAILED
    }

    public SubQuery {
        targetPages = targetPages != null ? List.copyOf(targetPages) : List.of();
        citations = citations != null ? List.copyOf(citations) : List.of();
    }

    public static SubQuery pending(String text, List<Integer> targetPages) {
        return new SubQuery(text, targetPages, null, List.of(), Status.PENDING);
    }

    public SubQuery answered(String answer, List<SourceCitation> sources) {
        return new SubQuery(this.text, this.targetPages, answer, sources, Status.ANSWERED);
    }

    public SubQuery withPlaceholder(String placeholder, Status status) {
        return new SubQuery(this.text, this.targetPages, placeholder, List.of(), status);
    }
}
