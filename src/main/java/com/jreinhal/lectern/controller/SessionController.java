package com.jreinhal.lectern.controller;

import com.jreinhal.lectern.model.ChatMessage;
import com.jreinhal.lectern.service.SessionService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = {"/api/sessions"})
public class SessionController {
    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping
    public ResponseEntity<List<SessionService.SessionSummary>> listSessions(@RequestParam String userId) {
        return ResponseEntity.ok(this.sessionService.listSessions(userId));
    }

    @GetMapping(value = {"/{sessionId}/messages"})
    public ResponseEntity<List<ChatMessage>> getMessages(@PathVariable String sessionId, @RequestParam String userId,
            @RequestParam(defaultValue = "50") int limit) {
        return this.sessionService.getMessages(userId, sessionId, limit)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping(value = {"/{sessionId}/clear"})
    public ResponseEntity<Map<String, String>> clearSession(@PathVariable String sessionId, @RequestParam String userId) {
        if (!this.sessionService.clearSession(userId, sessionId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "cleared", "sessionId", sessionId));
    }

    @DeleteMapping(value = {"/{sessionId}"})
    public ResponseEntity<Map<String, String>> deleteSession(@PathVariable String sessionId, @RequestParam String userId) {
        if (!this.sessionService.deleteSession(userId, sessionId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "deleted", "sessionId", sessionId));
    }
}
