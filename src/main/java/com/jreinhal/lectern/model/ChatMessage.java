package com.jreinhal.lectern.model;

import java.time.Instant;
import java.util.List;

public record ChatMessage(String role, String content, List<SourceCitation> sources, String strategy, Instant timestamp) {
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public ChatMessage {
        sources = sources != null ? List.copyOf(sources) : List.of();
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(ROLE_USER, content, List.of(), null, Instant.now());
    }

    public static ChatMessage assistant(String content, List<SourceCitation> sources, String strategy) {
        return new ChatMessage(ROLE_ASSISTANT, content, sources, strategy, Instant.now());
    }

    public boolean isUser() {
        return ROLE_USER.equals(this.role);
    }
}
