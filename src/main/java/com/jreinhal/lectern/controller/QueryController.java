package com.jreinhal.lectern.controller;

import com.jreinhal.lectern.dto.AnswerResponse;
import com.jreinhal.lectern.dto.AnswerStreamEvent;
import com.jreinhal.lectern.dto.QueryRequest;
import com.jreinhal.lectern.model.AnswerOutcome;
import com.jreinhal.lectern.service.RagOrchestrationService;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;

/**
 * Question answering over a session's documents.
 */
@RestController
@RequestMapping("/api/query")
public class QueryController {
    private static final Logger log = LoggerFactory.getLogger(QueryController.class);
    private final RagOrchestrationService ragOrchestrationService;

    public QueryController(RagOrchestrationService ragOrchestrationService) {
        this.ragOrchestrationService = ragOrchestrationService;
    }

    @PostMapping
    public ResponseEntity<AnswerResponse> answer(@RequestBody QueryRequest request) {
        AnswerResponse response = this.ragOrchestrationService.answerQuery(request);
        if (response.outcome() == AnswerOutcome.INVALID) {
            return ResponseEntity.badRequest().body(response);
        }
        if (response.outcome() == AnswerOutcome.SERVICE_UNAVAILABLE) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
        return ResponseEntity.ok(response);
    }

    /**
     * Server-sent events named after the event type: {@code layer-update},
     * {@code text-delta}, {@code source}, then {@code done} or {@code error}.
     */
    @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestBody QueryRequest request) {
        SseEmitter emitter = new SseEmitter(0L);
        Disposable subscription = this.ragOrchestrationService.streamAnswerQuery(request).subscribe(
                event -> this.send(emitter, event),
                emitter::completeWithError,
                emitter::complete);
        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(t -> subscription.dispose());
        return emitter;
    }

    private void send(SseEmitter emitter, AnswerStreamEvent event) {
        try {
            emitter.send(SseEmitter.event().name(event.type().wireName()).data(event, MediaType.APPLICATION_JSON));
        }
        catch (IOException e) {
            log.debug("Client went away during stream: {}", e.getMessage());
            emitter.completeWithError(e);
        }
    }
}
