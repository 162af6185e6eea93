package com.jreinhal.lectern.store;

import com.jreinhal.lectern.model.ChatMessage;
import com.jreinhal.lectern.model.ChatSession;
import java.util.List;
import java.util.Optional;

/**
 * Session records and their append-only message history.
 */
public interface ChatHistoryStore {

    /**
     * Returns the session's partition id, recording {@code partitionId} first if the
     * session has none yet. The first writer wins.
     */
    String bindPartition(String userId, String sessionId, String partitionId);

    void appendMessage(String userId, String sessionId, ChatMessage message);

    /**
     * The last {@code limit} messages in append order.
     */
    List<ChatMessage> getRecentMessages(String userId, String sessionId, int limit);

    Optional<ChatSession> findSession(String userId, String sessionId);

    List<ChatSession> listSessions(String userId);

    void clearMessages(String userId, String sessionId);

    boolean deleteSession(String userId, String sessionId);
}
