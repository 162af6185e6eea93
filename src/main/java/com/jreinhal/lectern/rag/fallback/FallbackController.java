package com.jreinhal.lectern.rag.fallback;

import com.jreinhal.lectern.constant.RagConstants;
import com.jreinhal.lectern.exception.PartitionUnavailableException;
import com.jreinhal.lectern.model.AnswerOutcome;
import com.jreinhal.lectern.rag.strategy.Strategy;
import com.jreinhal.lectern.rag.strategy.StrategySelector;
import com.jreinhal.lectern.util.CorrelatedTasks;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Degrades through strategies until one answers.
 *
 * <p>Order: {@code AGENTIC_DECOMPOSITION -> SMART_CHUNKING -> FULL_DOCUMENT -> SIMPLE_RAG},
 * entered at the selected strategy. {@code FULL_DOCUMENT} is skipped when the page count
 * is over the ceiling; selecting it in that case starts at {@code SMART_CHUNKING}
 * instead. Each attempt runs on {@code ragExecutor} under the stage timeout. Timeouts,
 * exceptions and soft failures move on to the next strategy; hard failures, executor
 * rejection and a lost partition end the chain. When the chain ends without an answer
 * the result is the generic apology. {@link #run} never throws.</p>
 */
@Component
public class FallbackController {
    private static final Logger log = LoggerFactory.getLogger(FallbackController.class);
    private static final List<Strategy> ORDER = List.of(
            Strategy.AGENTIC_DECOMPOSITION, Strategy.SMART_CHUNKING, Strategy.FULL_DOCUMENT, Strategy.SIMPLE_RAG);
    private final ExecutorService ragExecutor;
    private final StrategySelector strategySelector;
    @Value("${lectern.timeouts.stage-seconds:180}")
    private int stageTimeoutSeconds = 180;

    public FallbackController(@Qualifier("ragExecutor") ExecutorService ragExecutor, StrategySelector strategySelector) {
        this.ragExecutor = ragExecutor;
        this.strategySelector = strategySelector;
    }

    public List<Strategy> chain(Strategy initial, int totalPagesInScope) {
        boolean fullDocumentAllowed = this.strategySelector.fullDocumentAllowed(totalPagesInScope);
        Strategy start = initial;
        if (initial == Strategy.FULL_DOCUMENT && !fullDocumentAllowed) {
            log.warn("FULL_DOCUMENT selected for {} pages, over the ceiling; starting at SMART_CHUNKING", totalPagesInScope);
            start = Strategy.SMART_CHUNKING;
        }
        List<Strategy> chain = new ArrayList<>();
        for (Strategy strategy : ORDER.subList(ORDER.indexOf(start), ORDER.size())) {
            if (strategy != Strategy.FULL_DOCUMENT || fullDocumentAllowed) {
                chain.add(strategy);
            }
        }
        return chain;
    }

    public FallbackOutcome run(Strategy initial, int totalPagesInScope, PipelineRun run, StrategyStage stage) {
        List<Attempt> attempts = new ArrayList<>();
        Strategy last = initial;
        for (Strategy strategy : this.chain(initial, totalPagesInScope)) {
            last = strategy;
            int attemptId = run.beginAttempt(strategy);
            long start = System.currentTimeMillis();
            StageResult<StrategyAnswer> result = this.execute(strategy, attemptId, stage);
            long elapsed = System.currentTimeMillis() - start;
            attempts.add(new Attempt(strategy, result.kind(), result.reason(), elapsed));
            if (result.isSuccess()) {
                log.info("[{}] Strategy {} succeeded in {}ms", run.correlationId(), strategy, elapsed);
                run.advance(attemptId, PipelineState.RESPONDED);
                return new FallbackOutcome(result.value(), attempts);
            }
            log.warn("[{}] Strategy {} {} after {}ms: {}", run.correlationId(), strategy, result.kind(), elapsed, result.reason());
            run.note(strategy + " failed: " + result.reason());
            if (result.kind() == StageResult.Kind.HARD_FAILURE) {
                break;
            }
        }
        log.error("[{}] No strategy produced an answer ({} attempts); responding with apology", run.correlationId(), attempts.size());
        run.advance(PipelineState.ERROR_RESPONDED);
        StrategyAnswer apology = new StrategyAnswer(RagConstants.APOLOGY_MESSAGE, List.of(), last, AnswerOutcome.APOLOGY, "fallback chain exhausted");
        return new FallbackOutcome(apology, attempts);
    }

    private StageResult<StrategyAnswer> execute(Strategy strategy, int attemptId, StrategyStage stage) {
        CompletableFuture<StageResult<StrategyAnswer>> future;
        try {
            future = CompletableFuture.supplyAsync(CorrelatedTasks.wrap(() -> {
                try {
                    return stage.attempt(strategy, attemptId);
                }
                catch (RuntimeException e) {
                    throw e;
                }
                catch (Exception e) {
                    throw new CompletionException(e);
                }
            }), this.ragExecutor);
        }
        catch (RejectedExecutionException e) {
            return StageResult.hardFailure("executor overloaded", e);
        }
        try {
            StageResult<StrategyAnswer> result = future.get(this.stageTimeoutSeconds, TimeUnit.SECONDS);
            return result != null ? result : StageResult.softFailure("stage returned no result");
        }
        catch (TimeoutException e) {
            future.cancel(true);
            return StageResult.softFailure("timed out after " + this.stageTimeoutSeconds + "s", e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StageResult.hardFailure("interrupted", e);
        }
        catch (ExecutionException e) {
            return classify(e.getCause() != null ? e.getCause() : e);
        }
    }

    static StageResult<StrategyAnswer> classify(Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof PartitionUnavailableException || cause instanceof RejectedExecutionException) {
            return StageResult.hardFailure(cause.getClass().getSimpleName(), cause);
        }
        return StageResult.softFailure(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }

    public record Attempt(Strategy strategy, StageResult.Kind kind, String reason, long elapsedMs) {
    }

    public record FallbackOutcome(StrategyAnswer answer, List<Attempt> attempts) {
    }
}
