package com.jreinhal.lectern.store;

import com.jreinhal.lectern.model.ChatMessage;
import com.jreinhal.lectern.model.ChatSession;
import com.jreinhal.lectern.util.LogSanitizer;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

/**
 * Chat sessions in MongoDB. Every write is a single-document atomic update; messages
 * are appended with {@code $push} so concurrent appends interleave instead of
 * overwriting each other.
 */
@Component
public class MongoChatHistoryStore implements ChatHistoryStore {
    private static final Logger log = LoggerFactory.getLogger(MongoChatHistoryStore.class);
    private final MongoTemplate mongoTemplate;

    public MongoChatHistoryStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public String bindPartition(String userId, String sessionId, String partitionId) {
        Instant now = Instant.now();
        Update update = new Update()
                .setOnInsert("partitionId", partitionId)
                .setOnInsert("createdAt", now)
                .setOnInsert("updatedAt", now);
        FindAndModifyOptions options = FindAndModifyOptions.options().upsert(true).returnNew(true);
        ChatSession session;
        try {
            session = this.mongoTemplate.findAndModify(sessionQuery(userId, sessionId), update, options, ChatSession.class, ChatSession.COLLECTION);
        }
        catch (DuplicateKeyException e) {
            // Concurrent upsert on the unique (userId, sessionId) index; the other insert won.
            session = this.mongoTemplate.findOne(sessionQuery(userId, sessionId), ChatSession.class, ChatSession.COLLECTION);
        }
        if (session != null && session.partitionId() != null) {
            return session.partitionId();
        }
        Query unbound = sessionQuery(userId, sessionId).addCriteria(Criteria.where("partitionId").exists(false));
        this.mongoTemplate.updateFirst(unbound, new Update().set("partitionId", partitionId), ChatSession.class, ChatSession.COLLECTION);
        return this.findSession(userId, sessionId).map(ChatSession::partitionId).orElse(partitionId);
    }

    @Override
    public void appendMessage(String userId, String sessionId, ChatMessage message) {
        Instant now = Instant.now();
        Update update = new Update()
                .push("messages", message)
                .set("updatedAt", now)
                .setOnInsert("createdAt", now);
        this.mongoTemplate.upsert(sessionQuery(userId, sessionId), update, ChatSession.class, ChatSession.COLLECTION);
        log.debug("Appended {} message to session {}", message.role(), LogSanitizer.sanitize(sessionId));
    }

    @Override
    public List<ChatMessage> getRecentMessages(String userId, String sessionId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Query query = sessionQuery(userId, sessionId);
        query.fields().slice("messages", -limit);
        ChatSession session = this.mongoTemplate.findOne(query, ChatSession.class, ChatSession.COLLECTION);
        return session != null ? session.messages() : List.of();
    }

    @Override
    public Optional<ChatSession> findSession(String userId, String sessionId) {
        return Optional.ofNullable(this.mongoTemplate.findOne(sessionQuery(userId, sessionId), ChatSession.class, ChatSession.COLLECTION));
    }

    @Override
    public List<ChatSession> listSessions(String userId) {
        Query query = new Query(Criteria.where("userId").is(userId)).with(Sort.by(Sort.Direction.DESC, "updatedAt"));
        query.fields().exclude("messages");
        return this.mongoTemplate.find(query, ChatSession.class, ChatSession.COLLECTION);
    }

    @Override
    public void clearMessages(String userId, String sessionId) {
        Update update = new Update().set("messages", List.of()).set("updatedAt", Instant.now());
        this.mongoTemplate.updateFirst(sessionQuery(userId, sessionId), update, ChatSession.class, ChatSession.COLLECTION);
    }

    @Override
    public boolean deleteSession(String userId, String sessionId) {
        return this.mongoTemplate.remove(sessionQuery(userId, sessionId), ChatSession.class, ChatSession.COLLECTION).getDeletedCount() > 0L;
    }

    private static Query sessionQuery(String userId, String sessionId) {
        return new Query(Criteria.where("userId").is(userId).and("sessionId").is(sessionId));
    }
}
