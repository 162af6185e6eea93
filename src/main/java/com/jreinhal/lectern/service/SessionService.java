package com.jreinhal.lectern.service;

import com.jreinhal.lectern.model.ChatMessage;
import com.jreinhal.lectern.model.ChatSession;
import com.jreinhal.lectern.model.DocumentChunk;
import com.jreinhal.lectern.partition.PartitionManager;
import com.jreinhal.lectern.store.ChatHistoryStore;
import com.jreinhal.lectern.store.DocumentStore;
import com.jreinhal.lectern.util.LogSanitizer;
import com.jreinhal.lectern.vector.PartitionHandle;
import com.jreinhal.lectern.vector.VectorIndex;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SessionService {
    private static final Logger log = LoggerFactory.getLogger(SessionService.class);
    private final ChatHistoryStore chatHistoryStore;
    private final PartitionManager partitionManager;
    private final VectorIndex vectorIndex;
    private final DocumentStore documentStore;

    public SessionService(ChatHistoryStore chatHistoryStore, PartitionManager partitionManager, VectorIndex vectorIndex, DocumentStore documentStore) {
        this.chatHistoryStore = chatHistoryStore;
        this.partitionManager = partitionManager;
        this.vectorIndex = vectorIndex;
        this.documentStore = documentStore;
    }

    public List<SessionSummary> listSessions(String userId) {
        return this.chatHistoryStore.listSessions(userId).stream()
                .map(SessionSummary::of)
                .toList();
    }

    public Optional<List<ChatMessage>> getMessages(String userId, String sessionId, int limit) {
        if (this.chatHistoryStore.findSession(userId, sessionId).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(this.chatHistoryStore.getRecentMessages(userId, sessionId, Math.max(1, limit)));
    }

    /**
     * Empties the conversation history. The partition and its documents stay.
     */
    public boolean clearSession(String userId, String sessionId) {
        if (this.chatHistoryStore.findSession(userId, sessionId).isEmpty()) {
            return false;
        }
        this.chatHistoryStore.clearMessages(userId, sessionId);
        log.info("Cleared history for session {}", LogSanitizer.sanitize(sessionId));
        return true;
    }

    /**
     * Removes the session with its partition, indexed chunks and stored pages.
     */
    public boolean deleteSession(String userId, String sessionId) {
        Optional<ChatSession> session = this.chatHistoryStore.findSession(userId, sessionId);
        if (session.isEmpty()) {
            return false;
        }
        if (session.get().partitionId() != null) {
            PartitionHandle partition = this.partitionManager.resolve(userId, sessionId);
            List<String> fileIds = this.vectorIndex.distinctValues(partition, DocumentChunk.FILE_ID_KEY);
            for (String fileId : fileIds) {
                this.documentStore.deletePages(partition.partitionId(), fileId);
            }
            this.partitionManager.deletePartition(userId, sessionId);
            log.info("Deleted partition {} with {} files", partition.partitionId(), fileIds.size());
        }
        return this.chatHistoryStore.deleteSession(userId, sessionId);
    }

    public record SessionSummary(String sessionId, String partitionId, int messageCount, Instant createdAt, Instant updatedAt) {
        static SessionSummary of(ChatSession session) {
            return new SessionSummary(session.sessionId(), session.partitionId(), session.messages().size(), session.createdAt(), session.updatedAt());
        }
    }
}
