package com.jreinhal.lectern.service;

import com.jreinhal.lectern.constant.RagConstants;
import com.jreinhal.lectern.llm.GenerationClient;
import com.jreinhal.lectern.model.AnswerOutcome;
import com.jreinhal.lectern.model.DocumentChunk;
import com.jreinhal.lectern.model.DocumentPage;
import com.jreinhal.lectern.model.SourceCitation;
import com.jreinhal.lectern.rag.context.AssembledContext;
import com.jreinhal.lectern.rag.context.ContextAssembler;
import com.jreinhal.lectern.rag.decomposition.DecompositionEngine;
import com.jreinhal.lectern.rag.decomposition.DecompositionResult;
import com.jreinhal.lectern.rag.decomposition.SubQuery;
import com.jreinhal.lectern.rag.fallback.PipelineState;
import com.jreinhal.lectern.rag.fallback.StageResult;
import com.jreinhal.lectern.rag.fallback.StrategyAnswer;
import com.jreinhal.lectern.rag.prompt.AnswerPrompts;
import com.jreinhal.lectern.rag.rerank.LexicalOverlapReranker;
import com.jreinhal.lectern.rag.rerank.Reranker;
import com.jreinhal.lectern.rag.retrieval.RetrievalCandidate;
import com.jreinhal.lectern.rag.retrieval.RetrievalEngine;
import com.jreinhal.lectern.rag.strategy.Strategy;
import com.jreinhal.lectern.rag.strategy.StrategySelector;
import com.jreinhal.lectern.store.DocumentStore;
import com.jreinhal.lectern.util.AnswerText;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The four answer strategies. Each returns a {@link StageResult}: empty retrieval is a
 * successful "no relevant information" answer, while an empty result the strategy
 * cannot work with (no pages, every sub-query failed, blank generation) is a soft
 * failure. Capability exceptions are left to the fallback controller.
 */
@Component
public class StrategyStages {
    private static final Logger log = LoggerFactory.getLogger(StrategyStages.class);
    static final String LAYER_SEARCHING = "searching";
    static final String LAYER_READING = "reading";
    static final String LAYER_DECOMPOSING = "decomposing";
    static final String LAYER_GENERATING = "generating";
    private final RetrievalEngine retrievalEngine;
    private final Reranker reranker;
    private final ContextAssembler contextAssembler;
    private final DecompositionEngine decompositionEngine;
    private final StrategySelector strategySelector;
    private final DocumentStore documentStore;
    private final GenerationClient generationClient;

    public StrategyStages(RetrievalEngine retrievalEngine, Reranker reranker, ContextAssembler contextAssembler,
            DecompositionEngine decompositionEngine, StrategySelector strategySelector, DocumentStore documentStore,
            GenerationClient generationClient) {
        this.retrievalEngine = retrievalEngine;
        this.reranker = reranker;
        this.contextAssembler = contextAssembler;
        this.decompositionEngine = decompositionEngine;
        this.strategySelector = strategySelector;
        this.documentStore = documentStore;
        this.generationClient = generationClient;
    }

    StageResult<StrategyAnswer> attempt(Strategy strategy, int attemptId, QueryScope scope) {
        switch (strategy) {
            case AGENTIC_DECOMPOSITION:
                return this.agentic(attemptId, scope);
            case SMART_CHUNKING:
                return this.smartChunking(attemptId, scope);
            case FULL_DOCUMENT:
                return this.fullDocument(attemptId, scope);
            case SIMPLE_RAG:
                return this.simpleRag(attemptId, scope);
            default:
                return StageResult.softFailure("unsupported strategy " + strategy);
        }
    }

    StageResult<StrategyAnswer> agentic(int attemptId, QueryScope scope) {
        scope.run().layer(attemptId, LAYER_DECOMPOSING);
        scope.run().advance(attemptId, PipelineState.DECOMPOSE);
        List<SubQuery> subQueries = this.decompositionEngine.decompose(scope.query());
        scope.run().layer(attemptId, LAYER_SEARCHING);
        List<SubQuery> executed = this.decompositionEngine.executeAll(subQueries, scope.partition(), scope.filter(), scope.language());
        DecompositionResult partial = new DecompositionResult(null, executed, List.of());
        if (partial.allFailed()) {
            return StageResult.softFailure("all " + executed.size() + " sub-queries failed");
        }
        if (!partial.hasEvidence()) {
            return StageResult.success(noRelevantInfo(Strategy.AGENTIC_DECOMPOSITION));
        }
        scope.run().advance(attemptId, PipelineState.ASSEMBLE);
        scope.run().advance(attemptId, PipelineState.GENERATE);
        scope.run().layer(attemptId, LAYER_GENERATING);
        DecompositionResult result = this.decompositionEngine.synthesize(scope.query(), executed, scope.history(), scope.language());
        String detail = executed.size() + " sub-queries, " + result.count(SubQuery.Status.FAILED) + " failed";
        return this.finish(result.answer(), result.citations(), Strategy.AGENTIC_DECOMPOSITION, detail);
    }

    StageResult<StrategyAnswer> smartChunking(int attemptId, QueryScope scope) {
        scope.run().layer(attemptId, LAYER_SEARCHING);
        List<RetrievalCandidate> candidates = this.retrievalEngine.retrieveFocused(
                scope.query(), scope.partition(), this.retrievalEngine.defaultTopK(), scope.filter());
        if (candidates.isEmpty()) {
            return StageResult.success(noRelevantInfo(Strategy.SMART_CHUNKING));
        }
        List<RetrievalCandidate> ranked = this.reranker.rerank(scope.query(), candidates, this.contextAssembler.maxChunks());
        return this.generateGrounded(attemptId, scope, ranked, Strategy.SMART_CHUNKING);
    }

    StageResult<StrategyAnswer> simpleRag(int attemptId, QueryScope scope) {
        scope.run().layer(attemptId, LAYER_SEARCHING);
        List<RetrievalCandidate> candidates = this.retrievalEngine.retrieve(
                scope.query(), scope.partition(), this.retrievalEngine.defaultTopK(), scope.filter());
        if (candidates.isEmpty()) {
            return StageResult.success(noRelevantInfo(Strategy.SIMPLE_RAG));
        }
        return this.generateGrounded(attemptId, scope, candidates, Strategy.SIMPLE_RAG);
    }

    StageResult<StrategyAnswer> fullDocument(int attemptId, QueryScope scope) {
        scope.run().layer(attemptId, LAYER_READING);
        Map<String, List<DocumentPage>> pagesByFile = new LinkedHashMap<>();
        int totalPages = 0;
        String partitionId = scope.partition().partitionId();
        for (String fileId : scope.fileIds()) {
            List<DocumentPage> pages = this.documentStore.getPages(partitionId, fileId);
            if (pages.isEmpty()) {
                continue;
            }
            String fileName = this.documentStore.getFileName(partitionId, fileId).orElse(fileId);
            pagesByFile.merge(fileName, new ArrayList<>(pages), (a, b) -> {
                a.addAll(b);
                return a;
            });
            totalPages += pages.size();
        }
        if (totalPages == 0) {
            return StageResult.softFailure("no stored pages for " + scope.fileIds().size() + " files");
        }
        if (!this.strategySelector.fullDocumentAllowed(totalPages)) {
            return StageResult.softFailure(totalPages + " pages exceed the full-document ceiling");
        }
        scope.run().advance(attemptId, PipelineState.ASSEMBLE);
        String documents = this.contextAssembler.assembleDocuments(pagesByFile);
        scope.run().advance(attemptId, PipelineState.GENERATE);
        scope.run().layer(attemptId, LAYER_GENERATING);
        String raw = this.generationClient.complete(AnswerPrompts.fullDocument(scope.query(), documents, scope.history(), scope.language()));
        List<SourceCitation> citations = this.pageCitations(scope.query(), pagesByFile);
        return this.finish(raw, citations, Strategy.FULL_DOCUMENT, totalPages + " pages read");
    }

    private StageResult<StrategyAnswer> generateGrounded(int attemptId, QueryScope scope, List<RetrievalCandidate> ranked, Strategy strategy) {
        scope.run().advance(attemptId, PipelineState.ASSEMBLE);
        AssembledContext context = this.contextAssembler.assemble(ranked);
        scope.run().advance(attemptId, PipelineState.GENERATE);
        scope.run().layer(attemptId, LAYER_GENERATING);
        String raw = this.generationClient.complete(AnswerPrompts.grounded(scope.query(), context.contextText(), scope.history(), scope.language()));
        return this.finish(raw, context.citations(), strategy, context.chunkCount() + " chunks in context");
    }

    private StageResult<StrategyAnswer> finish(String raw, List<SourceCitation> citations, Strategy strategy, String detail) {
        String answer = AnswerText.clean(raw);
        if (answer.isEmpty()) {
            return StageResult.softFailure("generation produced no answer text");
        }
        List<SourceCitation> sources = citations;
        if (AnswerText.isNotFoundInDocument(answer)) {
            log.debug("Answer reports information not found; dropping {} citations", citations.size());
            sources = List.of();
        }
        return StageResult.success(new StrategyAnswer(answer, sources, strategy, AnswerOutcome.ANSWERED, detail));
    }

    /**
     * Citations for a whole-document answer: the pages sharing the most terms with the
     * query, or the first pages when nothing overlaps.
     */
    List<SourceCitation> pageCitations(String query, Map<String, List<DocumentPage>> pagesByFile) {
        Set<String> queryTerms = LexicalOverlapReranker.terms(query);
        List<RetrievalCandidate> scored = new ArrayList<>();
        for (Map.Entry<String, List<DocumentPage>> file : pagesByFile.entrySet()) {
            for (DocumentPage page : file.getValue()) {
                double overlap = LexicalOverlapReranker.overlap(queryTerms, page.content());
                DocumentChunk chunk = new DocumentChunk(null, null, file.getKey(), page.pageNumber(), page.content(), null);
                scored.add(RetrievalCandidate.of(chunk, 1.0 - overlap));
            }
        }
        scored.sort(Comparator.comparingDouble(RetrievalCandidate::score).reversed()
                .thenComparingInt(c -> c.chunk().pageNumber()));
        List<DocumentChunk> ranked = new ArrayList<>(scored.size());
        for (RetrievalCandidate candidate : scored) {
            ranked.add(candidate.chunk());
        }
        return this.contextAssembler.citationsFor(ranked);
    }

    private static StrategyAnswer noRelevantInfo(Strategy strategy) {
        return new StrategyAnswer(RagConstants.NO_RELEVANT_INFO_MESSAGE, List.of(), strategy, AnswerOutcome.NO_RELEVANT_INFO, "no candidates above threshold");
    }
}
