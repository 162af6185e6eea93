package com.jreinhal.lectern.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jreinhal.lectern.model.AnswerOutcome;
import com.jreinhal.lectern.model.SourceCitation;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnswerResponse(
        boolean success,
        String answer,
        List<SourceCitation> sources,
        String strategy,
        String route,
        String reasoning,
        AnswerOutcome outcome,
        String correlationId,
        String error) {

    public AnswerResponse {
        sources = sources != null ? List.copyOf(sources) : List.of();
    }

    public static AnswerResponse answered(String answer, List<SourceCitation> sources, String strategy, String route,
            String reasoning, AnswerOutcome outcome, String correlationId) {
        return new AnswerResponse(true, answer, sources, strategy, route, reasoning, outcome, correlationId, null);
    }

    public static AnswerResponse invalid(String error, String correlationId) {
        return new AnswerResponse(false, null, List.of(), null, null, null, AnswerOutcome.INVALID, correlationId, error);
    }

    public static AnswerResponse serviceUnavailable(String message, String correlationId) {
        return new AnswerResponse(false, message, List.of(), null, null, null, AnswerOutcome.SERVICE_UNAVAILABLE, correlationId, "service unavailable");
    }
}
