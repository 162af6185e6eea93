package com.jreinhal.lectern.model;

import java.time.Instant;
import java.util.List;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One conversation. Exactly one partition per (userId, sessionId); messages are
 * only ever appended with {@code $push}.
 */
@Document(collection = ChatSession.COLLECTION)
@CompoundIndex(name = "user_session_idx", def = "{'userId': 1, 'sessionId': 1}", unique = true)
public record ChatSession(
        @Id String id,
        String userId,
        String sessionId,
        String partitionId,
        List<ChatMessage> messages,
        Instant createdAt,
        Instant updatedAt) {
    public static final String COLLECTION = "chat_sessions";

    public ChatSession {
        messages = messages != null ? messages : List.of();
    }
}
