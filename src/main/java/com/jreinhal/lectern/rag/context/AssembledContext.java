package com.jreinhal.lectern.rag.context;

import com.jreinhal.lectern.model.SourceCitation;
import java.util.List;

public record AssembledContext(String contextText, List<SourceCitation> citations, int chunkCount) {

    public static AssembledContext empty() {
        return new AssembledContext("", List.of(), 0);
    }

    public boolean isEmpty() {
        return this.chunkCount == 0;
    }
}
