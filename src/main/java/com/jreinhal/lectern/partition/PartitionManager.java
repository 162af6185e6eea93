package com.jreinhal.lectern.partition;

import com.jreinhal.lectern.exception.PartitionUnavailableException;
import com.jreinhal.lectern.store.ChatHistoryStore;
import com.jreinhal.lectern.util.LogSanitizer;
import com.jreinhal.lectern.vector.PartitionHandle;
import com.jreinhal.lectern.vector.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Maps a (user, session) pair to its isolated retrieval partition.
 *
 * <p>Within the process, resolution goes through {@link PartitionCache#getOrCreate}, so
 * concurrent first requests for one session run the creation once. Across processes the
 * session record is bound with a first-writer-wins upsert and the index collection is
 * created idempotently, so every node converges on the same partition.</p>
 */
@Service
public class PartitionManager {
    private static final Logger log = LoggerFactory.getLogger(PartitionManager.class);
    private final PartitionCache partitionCache;
    private final ChatHistoryStore chatHistoryStore;
    private final VectorIndex vectorIndex;

    public PartitionManager(PartitionCache partitionCache, ChatHistoryStore chatHistoryStore, VectorIndex vectorIndex) {
        this.partitionCache = partitionCache;
        this.chatHistoryStore = chatHistoryStore;
        this.vectorIndex = vectorIndex;
    }

    public String getOrCreatePartition(String userId, String sessionId) {
        return this.resolve(userId, sessionId).partitionId();
    }

    /**
     * @throws PartitionUnavailableException if the partition cannot be created or resolved
     */
    public PartitionHandle resolve(String userId, String sessionId) {
        try {
            return this.partitionCache.getOrCreate(cacheKey(userId, sessionId), key -> this.create(userId, sessionId));
        }
        catch (PartitionUnavailableException e) {
            throw e;
        }
        catch (RuntimeException e) {
            log.error("Partition creation failed for user={} session={}", LogSanitizer.sanitize(userId), LogSanitizer.sanitize(sessionId), e);
            throw new PartitionUnavailableException(userId, sessionId, e);
        }
    }

    public void deletePartition(String userId, String sessionId) {
        String partitionId = this.chatHistoryStore.findSession(userId, sessionId)
                .map(session -> session.partitionId())
                .orElse(PartitionNames.partitionId(userId, sessionId));
        this.vectorIndex.deleteCollection(partitionId);
        this.partitionCache.invalidate(cacheKey(userId, sessionId));
        log.info("Deleted partition {}", partitionId);
    }

    private PartitionHandle create(String userId, String sessionId) {
        String candidate = PartitionNames.partitionId(userId, sessionId);
        String partitionId = this.chatHistoryStore.bindPartition(userId, sessionId, candidate);
        PartitionHandle handle = this.vectorIndex.createOrGet(partitionId);
        log.info("Resolved partition {} for user={} session={}", partitionId, LogSanitizer.sanitize(userId), LogSanitizer.sanitize(sessionId));
        return handle;
    }

    private static String cacheKey(String userId, String sessionId) {
        return userId + '\u0000' + sessionId;
    }
}
