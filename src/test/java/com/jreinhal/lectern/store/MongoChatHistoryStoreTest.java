package com.jreinhal.lectern.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.jreinhal.lectern.model.ChatMessage;
import com.jreinhal.lectern.model.ChatSession;
import com.mongodb.client.result.DeleteResult;
import java.time.Instant;
import java.util.List;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

class MongoChatHistoryStoreTest {

    private MongoTemplate mongoTemplate;
    private MongoChatHistoryStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        store = new MongoChatHistoryStore(mongoTemplate);
    }

    private static ChatSession session(String partitionId) {
        Instant now = Instant.now();
        return new ChatSession("id", "u1", "s1", partitionId, List.of(), now, now);
    }

    @Nested
    @DisplayName("bindPartition()")
    class BindPartition {

        @Test
        void existingBindingWins() {
            when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class), eq(ChatSession.class), eq(ChatSession.COLLECTION)))
                    .thenReturn(session("chat_first"));

            assertEquals("chat_first", store.bindPartition("u1", "s1", "chat_second"));
            verify(mongoTemplate, never()).updateFirst(any(Query.class), any(Update.class), eq(ChatSession.class), eq(ChatSession.COLLECTION));
        }

        @Test
        void duplicateKeyRereadsTheWinner() {
            when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class), eq(ChatSession.class), eq(ChatSession.COLLECTION)))
                    .thenThrow(new DuplicateKeyException("E11000"));
            when(mongoTemplate.findOne(any(Query.class), eq(ChatSession.class), eq(ChatSession.COLLECTION))).thenReturn(session("chat_winner"));

            assertEquals("chat_winner", store.bindPartition("u1", "s1", "chat_loser"));
        }

        @Test
        void sessionWithoutPartitionGetsBound() {
            when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class), eq(ChatSession.class), eq(ChatSession.COLLECTION)))
                    .thenReturn(session(null));
            when(mongoTemplate.findOne(any(Query.class), eq(ChatSession.class), eq(ChatSession.COLLECTION))).thenReturn(session("chat_new"));

            assertEquals("chat_new", store.bindPartition("u1", "s1", "chat_new"));

            ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
            verify(mongoTemplate).updateFirst(query.capture(), any(Update.class), eq(ChatSession.class), eq(ChatSession.COLLECTION));
            assertEquals(new Document("$exists", false), query.getValue().getQueryObject().get("partitionId"));
        }
    }

    @Test
    void appendPushesMessage() {
        ChatMessage message = ChatMessage.user("What is the fee?");

        store.appendMessage("u1", "s1", message);

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).upsert(any(Query.class), update.capture(), eq(ChatSession.class), eq(ChatSession.COLLECTION));
        Document push = (Document) update.getValue().getUpdateObject().get("$push");
        assertThat(push).containsKey("messages");
    }

    @Test
    void recentMessagesWithZeroLimitSkipsStore() {
        assertThat(store.getRecentMessages("u1", "s1", 0)).isEmpty();
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void recentMessagesOfMissingSessionIsEmpty() {
        when(mongoTemplate.findOne(any(Query.class), eq(ChatSession.class), eq(ChatSession.COLLECTION))).thenReturn(null);

        assertThat(store.getRecentMessages("u1", "s1", 8)).isEmpty();
    }

    @Test
    void deleteMissingSessionReturnsFalse() {
        when(mongoTemplate.remove(any(Query.class), eq(ChatSession.class), eq(ChatSession.COLLECTION))).thenReturn(DeleteResult.acknowledged(0L));

        assertFalse(store.deleteSession("u1", "s1"));
    }
}
