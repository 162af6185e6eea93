package com.jreinhal.lectern.rag.fallback;

import com.jreinhal.lectern.model.AnswerOutcome;
import com.jreinhal.lectern.model.SourceCitation;
import com.jreinhal.lectern.rag.strategy.Strategy;
import java.util.List;

/**
 * What a successful strategy hands back: the answer text, its citations and any notes
 * worth surfacing in the response's reasoning.
 */
public record StrategyAnswer(String answer, List<SourceCitation> sources, Strategy strategy, AnswerOutcome outcome, String detail) {

    public StrategyAnswer {
        sources = sources != null ? List.copyOf(sources) : List.of();
    }
}
