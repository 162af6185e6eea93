package com.jreinhal.lectern.service;

import com.jreinhal.lectern.constant.RagConstants;
import com.jreinhal.lectern.dto.AnswerResponse;
import com.jreinhal.lectern.dto.AnswerStreamEvent;
import com.jreinhal.lectern.dto.QueryRequest;
import com.jreinhal.lectern.exception.PartitionUnavailableException;
import com.jreinhal.lectern.llm.GenerationClient;
import com.jreinhal.lectern.model.AnswerOutcome;
import com.jreinhal.lectern.model.ChatMessage;
import com.jreinhal.lectern.model.DocumentChunk;
import com.jreinhal.lectern.model.SourceCitation;
import com.jreinhal.lectern.partition.PartitionManager;
import com.jreinhal.lectern.rag.classifier.QueryClassification;
import com.jreinhal.lectern.rag.classifier.QueryClassifier;
import com.jreinhal.lectern.rag.classifier.QueryRoute;
import com.jreinhal.lectern.rag.fallback.FallbackController;
import com.jreinhal.lectern.rag.fallback.PipelineRun;
import com.jreinhal.lectern.rag.fallback.PipelineState;
import com.jreinhal.lectern.rag.fallback.StrategyAnswer;
import com.jreinhal.lectern.rag.language.FixedMessage;
import com.jreinhal.lectern.rag.language.ResponseLanguage;
import com.jreinhal.lectern.rag.prompt.AnswerPrompts;
import com.jreinhal.lectern.rag.strategy.Strategy;
import com.jreinhal.lectern.rag.strategy.StrategySelector;
import com.jreinhal.lectern.store.ChatHistoryStore;
import com.jreinhal.lectern.util.AnswerText;
import com.jreinhal.lectern.util.LogSanitizer;
import com.jreinhal.lectern.vector.PartitionHandle;
import com.jreinhal.lectern.vector.VectorIndex;
import jakarta.annotation.PostConstruct;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point for answering a question inside one user's session.
 *
 * <p>A request is validated, bound to the session's partition, classified, and then
 * either answered directly (greetings, meta questions, sessions without documents) or
 * handed to the {@link FallbackController} starting at the strategy chosen by the
 * {@link StrategySelector}. Both turns are appended to the session history.</p>
 */
@Service
public class RagOrchestrationService {
    private static final Logger log = LoggerFactory.getLogger(RagOrchestrationService.class);
    static final String LAYER_CLASSIFYING = "classifying";
    static final int STREAM_WORDS_PER_CHUNK = 3;
    private final QueryValidator queryValidator;
    private final PartitionManager partitionManager;
    private final VectorIndex vectorIndex;
    private final ChatHistoryStore chatHistoryStore;
    private final QueryClassifier queryClassifier;
    private final StrategySelector strategySelector;
    private final FallbackController fallbackController;
    private final StrategyStages strategyStages;
    private final GenerationClient generationClient;
    private final AtomicInteger queryCount = new AtomicInteger(0);
    @Value("${lectern.history.turns:8}")
    private int historyTurns = 8;

    public RagOrchestrationService(QueryValidator queryValidator, PartitionManager partitionManager, VectorIndex vectorIndex,
            ChatHistoryStore chatHistoryStore, QueryClassifier queryClassifier, StrategySelector strategySelector,
            FallbackController fallbackController, StrategyStages strategyStages, GenerationClient generationClient) {
        this.queryValidator = queryValidator;
        this.partitionManager = partitionManager;
        this.vectorIndex = vectorIndex;
        this.chatHistoryStore = chatHistoryStore;
        this.queryClassifier = queryClassifier;
        this.strategySelector = strategySelector;
        this.fallbackController = fallbackController;
        this.strategyStages = strategyStages;
        this.generationClient = generationClient;
    }

    @PostConstruct
    public void init() {
        log.info("RAG orchestration ready (history turns: {})", this.historyTurns);
    }

    public AnswerResponse answerQuery(String query, String userId, String sessionId) {
        return this.answerQuery(new QueryRequest(query, userId, sessionId));
    }

    public AnswerResponse answerQuery(QueryRequest request) {
        return this.process(request, label -> { });
    }

    public Flux<AnswerStreamEvent> streamAnswerQuery(String query, String userId, String sessionId) {
        return this.streamAnswerQuery(new QueryRequest(query, userId, sessionId));
    }

    /**
     * Streams layer updates while the pipeline runs, then the answer as text deltas,
     * then one event per source, then {@code done}. Invalid input and an unavailable
     * partition end the stream with a single {@code error} event instead.
     */
    public Flux<AnswerStreamEvent> streamAnswerQuery(QueryRequest request) {
        Map<String, String> callerContext = MDC.getCopyOfContextMap();
        return Flux.<AnswerStreamEvent>create(sink -> {
            if (callerContext != null) {
                MDC.setContextMap(callerContext);
            }
            try {
                this.emit(request, sink);
            }
            finally {
                MDC.clear();
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    public int getQueryCount() {
        return this.queryCount.get();
    }

    private void emit(QueryRequest request, FluxSink<AnswerStreamEvent> sink) {
        try {
            AnswerResponse response = this.process(request, label -> {
                if (!sink.isCancelled()) {
                    sink.next(AnswerStreamEvent.layer(label));
                }
            });
            if (!response.success()) {
                String message = response.outcome() == AnswerOutcome.INVALID ? response.error() : response.answer();
                sink.next(AnswerStreamEvent.error(message));
                sink.complete();
                return;
            }
            for (String chunk : AnswerText.wordChunks(response.answer(), STREAM_WORDS_PER_CHUNK)) {
                if (sink.isCancelled()) {
                    log.debug("Stream cancelled by subscriber");
                    return;
                }
                sink.next(AnswerStreamEvent.textDelta(chunk));
            }
            for (SourceCitation source : response.sources()) {
                sink.next(AnswerStreamEvent.source(source));
            }
            sink.next(AnswerStreamEvent.done());
            sink.complete();
        }
        catch (RuntimeException e) {
            log.error("Streaming answer failed: {}", e.getMessage(), e);
            sink.next(AnswerStreamEvent.error(FixedMessage.APOLOGY.text(ResponseLanguage.detect(request.query()))));
            sink.complete();
        }
    }

    AnswerResponse process(QueryRequest request, Consumer<String> layerListener) {
        String correlationId = MDC.get("correlationId");
        if (correlationId == null) {
            correlationId = UUID.randomUUID().toString();
            MDC.put("correlationId", correlationId);
        }
        QueryValidator.Validation validation = this.queryValidator.validate(request.query(), request.userId(), request.sessionId());
        if (!validation.valid()) {
            log.warn("[{}] Rejected query: {}", correlationId, validation.error());
            return AnswerResponse.invalid(validation.error(), correlationId);
        }
        this.queryCount.incrementAndGet();
        long start = System.currentTimeMillis();
        ResponseLanguage language = ResponseLanguage.detect(validation.query());
        PipelineRun run = new PipelineRun(correlationId, layerListener);
        try {
            AnswerResponse response = this.runPipeline(request, validation.query(), language, run);
            log.info("[{}] Answered {} via {} in {}ms ({})", correlationId, LogSanitizer.querySummary(validation.query()),
                    response.strategy() != null ? response.strategy() : response.route(), System.currentTimeMillis() - start, response.outcome());
            return response;
        }
        catch (PartitionUnavailableException e) {
            log.error("[{}] Partition unavailable for session {}: {}", correlationId, LogSanitizer.sanitize(request.sessionId()), e.getMessage(), e);
            return AnswerResponse.serviceUnavailable(FixedMessage.SERVICE_UNAVAILABLE.text(language), correlationId);
        }
        catch (RuntimeException e) {
            log.error("[{}] Pipeline failed: {}", correlationId, e.getMessage(), e);
            return AnswerResponse.answered(FixedMessage.APOLOGY.text(language), List.of(), null, null, run.reasoning(), AnswerOutcome.APOLOGY, correlationId);
        }
    }

    private AnswerResponse runPipeline(QueryRequest request, String query, ResponseLanguage language, PipelineRun run) {
        String userId = request.userId();
        String sessionId = request.sessionId();
        run.layer(LAYER_CLASSIFYING);
        PartitionHandle partition = this.partitionManager.resolve(userId, sessionId);
        List<ChatMessage> history = this.recentHistory(userId, sessionId);
        long chunkCount = this.countChunks(partition);
        boolean hasDocuments = chunkCount != 0;

        QueryClassification classification = this.queryClassifier.classify(query, hasDocuments, history);
        run.note("language " + language.code());
        run.note("route " + classification.route() + " (" + classification.source() + "): " + classification.reason());
        run.layer(classification.route().name());
        this.append(userId, sessionId, ChatMessage.user(query));

        StrategyAnswer answer;
        switch (classification.route()) {
            case GREETING:
                run.advance(PipelineState.RESPONDED);
                answer = new StrategyAnswer(this.queryClassifier.greetingReply(query), List.of(), null, AnswerOutcome.GREETING, "lexical reply");
                break;
            case SIMPLE:
                run.advance(PipelineState.RESPONDED);
                answer = this.answerSimple(query, hasDocuments, history, language);
                break;
            default:
                run.advance(PipelineState.ROUTE);
                answer = this.answerFromDocuments(request, query, language, partition, chunkCount, history, run);
                break;
        }

        answer = localize(answer, language);
        String strategy = answer.strategy() != null ? answer.strategy().name() : null;
        if (answer.detail() != null) {
            run.note(answer.detail());
        }
        this.append(userId, sessionId, ChatMessage.assistant(answer.answer(), answer.sources(), strategy));
        return AnswerResponse.answered(answer.answer(), answer.sources(), strategy, classification.route().name(),
                run.reasoning(), answer.outcome(), run.correlationId());
    }

    private StrategyAnswer answerSimple(String query, boolean hasDocuments, List<ChatMessage> history, ResponseLanguage language) {
        if (!hasDocuments && !this.queryClassifier.isMetaQuestion(query)) {
            return new StrategyAnswer(RagConstants.UPLOAD_PROMPT_MESSAGE, List.of(), null, AnswerOutcome.NO_DOCUMENTS, "no documents in session");
        }
        try {
            String answer = AnswerText.clean(this.generationClient.complete(AnswerPrompts.simple(query, history, language)));
            if (!answer.isEmpty()) {
                return new StrategyAnswer(answer, List.of(), null, AnswerOutcome.ANSWERED, "direct answer");
            }
        }
        catch (RuntimeException e) {
            log.warn("Direct answer generation failed: {}", e.getMessage());
        }
        return new StrategyAnswer(FixedMessage.SIMPLE_FALLBACK.text(language), List.of(), null, AnswerOutcome.ANSWERED, "static reply");
    }

    private StrategyAnswer answerFromDocuments(QueryRequest request, String query, ResponseLanguage language, PartitionHandle partition, long chunkCount,
            List<ChatMessage> history, PipelineRun run) {
        if (chunkCount == 0) {
            run.advance(PipelineState.RESPONDED);
            return new StrategyAnswer(RagConstants.UPLOAD_PROMPT_MESSAGE, List.of(), null, AnswerOutcome.NO_DOCUMENTS, "partition is empty");
        }
        List<String> partitionFiles = this.vectorIndex.distinctValues(partition, DocumentChunk.FILE_ID_KEY);
        List<String> mentioned = ownedFiles(request.mentionedFileIds(), partitionFiles);
        long ignored = request.mentionedFileIds().stream().distinct().count() - mentioned.size();
        if (ignored > 0) {
            log.warn("[{}] Ignoring {} mentioned files outside partition {}", run.correlationId(), ignored, partition.partitionId());
            run.note("ignored " + ignored + " mentioned files outside the session");
        }
        Map<String, Object> filter = mentioned.isEmpty() ? Map.of() : Map.of(DocumentChunk.FILE_ID_KEY, mentioned);
        List<String> fileIds = mentioned.isEmpty() ? partitionFiles : mentioned;
        int totalPages = (int) Math.min(Integer.MAX_VALUE, this.vectorIndex.count(partition, filter));
        Strategy initial = this.strategySelector.selectStrategy(totalPages, query);
        run.note("strategy " + initial + " for " + totalPages + " pages in " + fileIds.size() + " files");

        QueryScope scope = new QueryScope(query, language, partition, filter, fileIds, history, run);
        FallbackController.FallbackOutcome outcome = this.fallbackController.run(initial, totalPages, run,
                (strategy, attemptId) -> this.strategyStages.attempt(strategy, attemptId, scope));
        return outcome.answer();
    }

    /**
     * Swaps the English text of a fixed-message outcome for the query's language.
     */
    static StrategyAnswer localize(StrategyAnswer answer, ResponseLanguage language) {
        FixedMessage message;
        switch (answer.outcome()) {
            case NO_DOCUMENTS:
                message = FixedMessage.UPLOAD_PROMPT;
                break;
            case NO_RELEVANT_INFO:
                message = FixedMessage.NO_RELEVANT_INFO;
                break;
            case APOLOGY:
                message = FixedMessage.APOLOGY;
                break;
            default:
                return answer;
        }
        return new StrategyAnswer(message.text(language), answer.sources(), answer.strategy(), answer.outcome(), answer.detail());
    }

    /**
     * The mentioned file ids that belong to the partition, in mention order. Ids from
     * other sessions never reach a search filter or a page read.
     */
    static List<String> ownedFiles(List<String> mentioned, List<String> partitionFiles) {
        Set<String> owned = new HashSet<>(partitionFiles);
        return mentioned.stream()
                .filter(owned::contains)
                .distinct()
                .toList();
    }

    private List<ChatMessage> recentHistory(String userId, String sessionId) {
        try {
            return this.chatHistoryStore.getRecentMessages(userId, sessionId, this.historyTurns);
        }
        catch (RuntimeException e) {
            log.warn("Could not load history for session {}: {}", LogSanitizer.sanitize(sessionId), e.getMessage());
            return List.of();
        }
    }

    private long countChunks(PartitionHandle partition) {
        try {
            return this.vectorIndex.count(partition, Map.of());
        }
        catch (RuntimeException e) {
            log.warn("Could not count chunks in {}, assuming documents are present: {}", partition.partitionId(), e.getMessage());
            return -1L;
        }
    }

    private void append(String userId, String sessionId, ChatMessage message) {
        try {
            this.chatHistoryStore.appendMessage(userId, sessionId, message);
        }
        catch (RuntimeException e) {
            log.warn("Failed to record {} message for session {}: {}", message.role(), LogSanitizer.sanitize(sessionId), e.getMessage());
        }
    }
}
