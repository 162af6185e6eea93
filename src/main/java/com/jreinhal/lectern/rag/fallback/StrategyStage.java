package com.jreinhal.lectern.rag.fallback;

import com.jreinhal.lectern.rag.strategy.Strategy;

/**
 * Runs one strategy for the current request. Returning a failure result and throwing
 * are both allowed; the {@link FallbackController} classifies thrown exceptions.
 */
@FunctionalInterface
public interface StrategyStage {
    StageResult<StrategyAnswer> attempt(Strategy strategy, int attemptId) throws Exception;
}
