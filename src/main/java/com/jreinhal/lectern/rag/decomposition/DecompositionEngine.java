package com.jreinhal.lectern.rag.decomposition;

import com.jreinhal.lectern.constant.RagConstants;
import com.jreinhal.lectern.llm.GenerationClient;
import com.jreinhal.lectern.model.ChatMessage;
import com.jreinhal.lectern.model.DocumentChunk;
import com.jreinhal.lectern.model.SourceCitation;
import com.jreinhal.lectern.rag.context.AssembledContext;
import com.jreinhal.lectern.rag.context.ContextAssembler;
import com.jreinhal.lectern.rag.language.ResponseLanguage;
import com.jreinhal.lectern.rag.prompt.AnswerPrompts;
import com.jreinhal.lectern.rag.rerank.Reranker;
import com.jreinhal.lectern.rag.retrieval.RetrievalCandidate;
import com.jreinhal.lectern.rag.retrieval.RetrievalEngine;
import com.jreinhal.lectern.util.AnswerText;
import com.jreinhal.lectern.util.CorrelatedTasks;
import com.jreinhal.lectern.vector.PartitionHandle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Agentic decomposition: split, answer each part from the partition, synthesize.
 *
 * <p>Sub-queries run in batches of {@code batchSize}; a batch starts only after the
 * previous one has settled. A sub-query that fails or times out gets
 * {@link RagConstants#SUB_QUERY_FAILED_PLACEHOLDER} and the others carry on. When no
 * part yields evidence the result has no answer and the caller decides what to do;
 * a synthesis failure propagates.</p>
 */
@Service
public class DecompositionEngine {
    private static final Logger log = LoggerFactory.getLogger(DecompositionEngine.class);
    private static final String NOT_FOUND_MARKER = "NOT FOUND";
    private final QueryDecomposer queryDecomposer;
    private final RetrievalEngine retrievalEngine;
    private final Reranker reranker;
    private final ContextAssembler contextAssembler;
    private final GenerationClient generationClient;
    private final ExecutorService subQueryExecutor;
    @Value("${lectern.decomposition.batch-size:" + RagConstants.SUB_QUERY_BATCH_SIZE + "}")
    private int batchSize = RagConstants.SUB_QUERY_BATCH_SIZE;
    @Value("${lectern.retrieval.sub-query-top-k:" + RagConstants.DEFAULT_SUB_QUERY_TOP_K + "}")
    private int subQueryTopK = RagConstants.DEFAULT_SUB_QUERY_TOP_K;
    @Value("${lectern.rerank.limit:" + RagConstants.DEFAULT_RERANK_LIMIT + "}")
    private int rerankLimit = RagConstants.DEFAULT_RERANK_LIMIT;
    @Value("${lectern.timeouts.sub-query-seconds:120}")
    private int subQueryTimeoutSeconds = 120;

    public DecompositionEngine(QueryDecomposer queryDecomposer, RetrievalEngine retrievalEngine, Reranker reranker,
            ContextAssembler contextAssembler, GenerationClient generationClient,
            @Qualifier("subQueryExecutor") ExecutorService subQueryExecutor) {
        this.queryDecomposer = queryDecomposer;
        this.retrievalEngine = retrievalEngine;
        this.reranker = reranker;
        this.contextAssembler = contextAssembler;
        this.generationClient = generationClient;
        this.subQueryExecutor = subQueryExecutor;
    }

    public List<SubQuery> decompose(String query) {
        return this.queryDecomposer.decompose(query);
    }

    /**
     * Runs every sub-query, batch by batch, preserving input order in the result.
     */
    public List<SubQuery> executeAll(List<SubQuery> subQueries, PartitionHandle partition, Map<String, Object> filter, ResponseLanguage language) {
        int size = Math.max(1, this.batchSize);
        List<SubQuery> executed = new ArrayList<>(subQueries.size());
        for (int start = 0; start < subQueries.size(); start += size) {
            List<SubQuery> batch = subQueries.subList(start, Math.min(start + size, subQueries.size()));
            List<CompletableFuture<SubQuery>> futures = new ArrayList<>(batch.size());
            for (SubQuery subQuery : batch) {
                futures.add(this.submit(subQuery, partition, filter, language));
            }
            for (int i = 0; i < batch.size(); ++i) {
                executed.add(this.await(futures.get(i), batch.get(i)));
            }
        }
        long failed = executed.stream().filter(s -> s.status() == SubQuery.Status.FAILED).count();
        log.info("Executed {} sub-queries ({} failed)", executed.size(), failed);
        return executed;
    }

    /**
     * One generation call over the ordered sub-answers. Without any answered sub-query
     * there is nothing to synthesize and the result carries no answer.
     */
    public DecompositionResult synthesize(String query, List<SubQuery> executed, List<ChatMessage> history, ResponseLanguage language) {
        List<SubQuery> answered = executed.stream().filter(s -> s.status() == SubQuery.Status.ANSWERED).collect(Collectors.toList());
        if (answered.isEmpty()) {
            return new DecompositionResult(null, executed, List.of());
        }
        List<SourceCitation> citations = this.contextAssembler.mergeCitations(
                answered.stream().map(SubQuery::citations).collect(Collectors.toList()));
        String synthesized = AnswerText.clean(this.generationClient.complete(AnswerPrompts.synthesis(query, executed, history, language)));
        return new DecompositionResult(synthesized, executed, citations);
    }

    SubQuery answer(SubQuery subQuery, PartitionHandle partition, Map<String, Object> filter, ResponseLanguage language) {
        Map<String, Object> scoped = new HashMap<>(filter);
        if (!subQuery.targetPages().isEmpty()) {
            scoped.put(DocumentChunk.PAGE_NUMBER_KEY, subQuery.targetPages());
        }
        List<RetrievalCandidate> candidates = this.retrievalEngine.retrieve(subQuery.text(), partition, this.subQueryTopK, scoped);
        if (candidates.isEmpty()) {
            return subQuery.withPlaceholder(RagConstants.SUB_QUERY_EMPTY_PLACEHOLDER, SubQuery.Status.EMPTY);
        }
        AssembledContext context = this.contextAssembler.assemble(this.reranker.rerank(subQuery.text(), candidates, this.rerankLimit));
        String subAnswer = AnswerText.clean(this.generationClient.complete(AnswerPrompts.subAnswer(subQuery.text(), context.contextText(), language)));
        if (subAnswer.isEmpty() || subAnswer.toUpperCase(Locale.ROOT).startsWith(NOT_FOUND_MARKER)) {
            return subQuery.withPlaceholder(RagConstants.SUB_QUERY_EMPTY_PLACEHOLDER, SubQuery.Status.EMPTY);
        }
        return subQuery.answered(subAnswer, context.citations());
    }

    private CompletableFuture<SubQuery> submit(SubQuery subQuery, PartitionHandle partition, Map<String, Object> filter, ResponseLanguage language) {
        try {
            return CompletableFuture.supplyAsync(CorrelatedTasks.wrap(() -> this.answer(subQuery, partition, filter, language)), this.subQueryExecutor);
        }
        catch (RejectedExecutionException e) {
            log.warn("Sub-query rejected by executor: {}", e.getMessage());
            return CompletableFuture.completedFuture(subQuery.withPlaceholder(RagConstants.SUB_QUERY_FAILED_PLACEHOLDER, SubQuery.Status.FAILED));
        }
    }

    private SubQuery await(CompletableFuture<SubQuery> future, SubQuery subQuery) {
        try {
            return future.get(this.subQueryTimeoutSeconds, TimeUnit.SECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Sub-query timed out after {}s", this.subQueryTimeoutSeconds);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Sub-query failed: {}: {}", cause.getClass().getSimpleName(), cause.getMessage());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for sub-query");
        }
        return subQuery.withPlaceholder(RagConstants.SUB_QUERY_FAILED_PLACEHOLDER, SubQuery.Status.FAILED);
    }
}
