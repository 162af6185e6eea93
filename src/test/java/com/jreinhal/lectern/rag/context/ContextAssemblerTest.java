package com.jreinhal.lectern.rag.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.jreinhal.lectern.constant.RagConstants;
import com.jreinhal.lectern.model.DocumentChunk;
import com.jreinhal.lectern.model.DocumentPage;
import com.jreinhal.lectern.model.SourceCitation;
import com.jreinhal.lectern.rag.retrieval.RetrievalCandidate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class ContextAssemblerTest {

    private final ContextAssembler assembler = new ContextAssembler();

    private static RetrievalCandidate candidate(String fileName, int page, String content, double distance) {
        return RetrievalCandidate.of(new DocumentChunk(fileName + "_p" + page, fileName, fileName, page, content, "en"), distance);
    }

    @Test
    void usesAtMostFiveChunksWithSourceHeaders() {
        List<RetrievalCandidate> candidates = new ArrayList<>();
        for (int i = 1; i <= 8; i++) {
            candidates.add(candidate("notes.pdf", i, "page text " + i, 0.1));
        }

        AssembledContext context = assembler.assemble(candidates);

        assertThat(context.chunkCount()).isEqualTo(5);
        assertThat(context.contextText()).startsWith("[Source 1: notes.pdf, Page 1]\npage text 1");
        assertThat(context.contextText()).contains("[Source 5: notes.pdf, Page 5]").doesNotContain("Page 6");
        assertThat(context.contextText().split(RagConstants.CONTEXT_SEPARATOR, -1)).hasSize(5);
    }

    @Test
    void citationsAreDistinctAndCappedAtThree() {
        List<RetrievalCandidate> candidates = List.of(
                candidate("a.pdf", 1, "one", 0.1),
                candidate("a.pdf", 1, "one again", 0.1),
                candidate("a.pdf", 2, "two", 0.2),
                candidate("b.pdf", 1, "three", 0.3),
                candidate("b.pdf", 2, "four", 0.4));

        List<SourceCitation> citations = assembler.assemble(candidates).citations();

        assertThat(citations).hasSize(3);
        assertThat(citations).extracting(SourceCitation::fileName, SourceCitation::pageNo)
                .containsExactly(
                        tuple("a.pdf", 1),
                        tuple("a.pdf", 2),
                        tuple("b.pdf", 1));
    }

    @Test
    void dropsLowestRankedChunksWhenOverBudget() {
        ReflectionTestUtils.setField(assembler, "maxChars", 120);
        List<RetrievalCandidate> candidates = List.of(
                candidate("a.pdf", 1, "x".repeat(60), 0.1),
                candidate("a.pdf", 2, "y".repeat(60), 0.2),
                candidate("a.pdf", 3, "z".repeat(60), 0.3));

        AssembledContext context = assembler.assemble(candidates);

        assertThat(context.chunkCount()).isEqualTo(1);
        assertThat(context.contextText()).contains("xxxx").doesNotContain("yyyy");
        assertThat(context.citations()).extracting(SourceCitation::pageNo).containsExactly(1);
    }

    @Test
    void cutsSingleOversizedChunk() {
        ReflectionTestUtils.setField(assembler, "maxChars", 50);

        AssembledContext context = assembler.assemble(List.of(candidate("a.pdf", 1, "w".repeat(500), 0.1)));

        assertThat(context.contextText()).hasSize(50);
        assertThat(context.chunkCount()).isEqualTo(1);
    }

    @Test
    void emptyCandidatesGiveEmptyContext() {
        AssembledContext context = assembler.assemble(List.of());
        assertThat(context.isEmpty()).isTrue();
        assertThat(context.citations()).isEmpty();
    }

    @Test
    void snippetIsFlattenedAndShortened() {
        String snippet = assembler.snippet("line one\n\nline two " + "z".repeat(200));
        assertThat(snippet).startsWith("line one line two").endsWith("...").hasSize(103);
    }

    @Test
    void documentsAreLaidOutPageByPage() {
        Map<String, List<DocumentPage>> pages = new LinkedHashMap<>();
        pages.put("first.pdf", List.of(new DocumentPage(2, "beta"), new DocumentPage(1, "alpha")));
        pages.put("second.pdf", List.of(new DocumentPage(1, "gamma")));

        String text = assembler.assembleDocuments(pages);

        assertThat(text).startsWith("Document: first.pdf\n\n[Page 1]\nalpha\n\n[Page 2]\nbeta");
        assertThat(text).contains(RagConstants.DOCUMENT_BREAK + "Document: second.pdf");
    }

    @Test
    void mergedCitationsKeepFirstOccurrence() {
        SourceCitation a1 = new SourceCitation("a.pdf", 1, "first");
        SourceCitation a1Again = new SourceCitation("a.pdf", 1, "second");
        SourceCitation b2 = new SourceCitation("b.pdf", 2, "third");

        List<SourceCitation> merged = assembler.mergeCitations(List.of(List.of(a1), List.of(a1Again, b2)));

        assertThat(merged).containsExactly(a1, b2);
    }
}
