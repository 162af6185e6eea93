package com.jreinhal.lectern.rag.context;

import com.jreinhal.lectern.constant.RagConstants;
import com.jreinhal.lectern.model.DocumentChunk;
import com.jreinhal.lectern.model.DocumentPage;
import com.jreinhal.lectern.model.SourceCitation;
import com.jreinhal.lectern.rag.retrieval.RetrievalCandidate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Turns ranked chunks into prompt context plus citations.
 *
 * <p>At most {@code maxChunks} chunks are used, each headed by
 * {@code [Source i: fileName, Page p]} and separated by {@link RagConstants#CONTEXT_SEPARATOR}.
 * When the text exceeds {@code maxChars} the lowest-ranked chunks are dropped first; a
 * lone chunk that is still too long is cut. Citations come from the included chunks in
 * rank order, one per distinct (fileName, page), at most {@code maxCitations}.</p>
 */
@Service
public class ContextAssembler {
    @Value("${lectern.context.max-chunks:" + RagConstants.DEFAULT_CONTEXT_CHUNKS + "}")
    private int maxChunks = RagConstants.DEFAULT_CONTEXT_CHUNKS;
    @Value("${lectern.context.max-chars:" + RagConstants.DEFAULT_CONTEXT_CHARS + "}")
    private int maxChars = RagConstants.DEFAULT_CONTEXT_CHARS;
    @Value("${lectern.context.max-citations:" + RagConstants.DEFAULT_MAX_CITATIONS + "}")
    private int maxCitations = RagConstants.DEFAULT_MAX_CITATIONS;
    @Value("${lectern.context.snippet-length:" + RagConstants.DEFAULT_SNIPPET_LENGTH + "}")
    private int snippetLength = RagConstants.DEFAULT_SNIPPET_LENGTH;

    public AssembledContext assemble(List<RetrievalCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return AssembledContext.empty();
        }
        List<DocumentChunk> chunks = new ArrayList<>();
        for (RetrievalCandidate candidate : candidates) {
            if (chunks.size() >= this.maxChunks) {
                break;
            }
            chunks.add(candidate.chunk());
        }
        List<String> blocks = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); ++i) {
            DocumentChunk chunk = chunks.get(i);
            blocks.add("[Source " + (i + 1) + ": " + chunk.fileName() + ", Page " + chunk.pageNumber() + "]\n" + chunk.content());
        }
        while (blocks.size() > 1 && joinedLength(blocks) > this.maxChars) {
            blocks.remove(blocks.size() - 1);
        }
        if (joinedLength(blocks) > this.maxChars) {
            blocks.set(0, blocks.get(0).substring(0, this.maxChars));
        }
        List<DocumentChunk> included = chunks.subList(0, blocks.size());
        return new AssembledContext(String.join(RagConstants.CONTEXT_SEPARATOR, blocks), this.citationsFor(included), blocks.size());
    }

    /**
     * Context for whole files: pages in ascending order as {@code [Page n]} blocks, files
     * separated by {@link RagConstants#DOCUMENT_BREAK}.
     */
    public String assembleDocuments(Map<String, List<DocumentPage>> pagesByFileName) {
        List<String> documents = new ArrayList<>();
        for (Map.Entry<String, List<DocumentPage>> file : pagesByFileName.entrySet()) {
            StringBuilder text = new StringBuilder("Document: ").append(file.getKey()).append("\n\n");
            file.getValue().stream()
                    .sorted((a, b) -> Integer.compare(a.pageNumber(), b.pageNumber()))
                    .forEach(page -> text.append("[Page ").append(page.pageNumber()).append("]\n").append(page.content()).append("\n\n"));
            documents.add(text.toString().trim());
        }
        return String.join(RagConstants.DOCUMENT_BREAK, documents);
    }

    public List<SourceCitation> citationsFor(List<DocumentChunk> rankedChunks) {
        Map<String, SourceCitation> distinct = new LinkedHashMap<>();
        for (DocumentChunk chunk : rankedChunks) {
            if (distinct.size() >= this.maxCitations) {
                break;
            }
            distinct.putIfAbsent(citationKey(chunk.fileName(), chunk.pageNumber()),
                    new SourceCitation(chunk.fileName(), chunk.pageNumber(), this.snippet(chunk.content())));
        }
        return List.copyOf(distinct.values());
    }

    /**
     * Union of citation lists in order, without duplicate (fileName, page) pairs, capped.
     */
    public List<SourceCitation> mergeCitations(Collection<List<SourceCitation>> citationLists) {
        Set<String> seen = new LinkedHashSet<>();
        List<SourceCitation> merged = new ArrayList<>();
        for (List<SourceCitation> citations : citationLists) {
            for (SourceCitation citation : citations) {
                if (merged.size() >= this.maxCitations) {
                    return merged;
                }
                if (seen.add(citationKey(citation.fileName(), citation.pageNo()))) {
                    merged.add(citation);
                }
            }
        }
        return merged;
    }

    public int maxChunks() {
        return this.maxChunks;
    }

    String snippet(String content) {
        if (content == null) {
            return "";
        }
        String flat = content.replaceAll("\\s+", " ").trim();
        return flat.length() <= this.snippetLength ? flat : flat.substring(0, this.snippetLength) + "...";
    }

    private static String citationKey(String fileName, int page) {
        return fileName + '\u0000' + page;
    }

    private static int joinedLength(List<String> blocks) {
        int length = 0;
        for (String block : blocks) {
            length += block.length();
        }
        return length + Math.max(0, blocks.size() - 1) * RagConstants.CONTEXT_SEPARATOR.length();
    }
}
