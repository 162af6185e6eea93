package com.jreinhal.lectern.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.lectern.constant.RagConstants;
import com.jreinhal.lectern.dto.AnswerResponse;
import com.jreinhal.lectern.dto.AnswerStreamEvent;
import com.jreinhal.lectern.dto.QueryRequest;
import com.jreinhal.lectern.exception.PartitionUnavailableException;
import com.jreinhal.lectern.exception.VectorSearchException;
import com.jreinhal.lectern.llm.GenerationClient;
import com.jreinhal.lectern.llm.QueryEmbedder;
import com.jreinhal.lectern.model.AnswerOutcome;
import com.jreinhal.lectern.model.ChatMessage;
import com.jreinhal.lectern.model.DocumentChunk;
import com.jreinhal.lectern.model.DocumentPage;
import com.jreinhal.lectern.model.SourceCitation;
import com.jreinhal.lectern.partition.PartitionManager;
import com.jreinhal.lectern.rag.classifier.QueryClassifier;
import com.jreinhal.lectern.rag.context.ContextAssembler;
import com.jreinhal.lectern.rag.decomposition.DecompositionEngine;
import com.jreinhal.lectern.rag.fallback.FallbackController;
import com.jreinhal.lectern.rag.fallback.StageResult;
import com.jreinhal.lectern.rag.fallback.StrategyAnswer;
import com.jreinhal.lectern.rag.language.FixedMessage;
import com.jreinhal.lectern.rag.language.ResponseLanguage;
import com.jreinhal.lectern.rag.rerank.ScoreOrderReranker;
import com.jreinhal.lectern.rag.retrieval.RetrievalEngine;
import com.jreinhal.lectern.rag.strategy.Strategy;
import com.jreinhal.lectern.rag.strategy.StrategySelector;
import com.jreinhal.lectern.store.ChatHistoryStore;
import com.jreinhal.lectern.store.DocumentStore;
import com.jreinhal.lectern.vector.PartitionHandle;
import com.jreinhal.lectern.vector.VectorIndex;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.Message;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

class RagOrchestrationServiceTest {

    private static final PartitionHandle PARTITION = new PartitionHandle("chat_u1_s1_abc", "chat_u1_s1_abc");

    private PartitionManager partitionManager;
    private VectorIndex vectorIndex;
    private ChatHistoryStore chatHistoryStore;
    private GenerationClient generationClient;
    private StrategyStages strategyStages;
    private ExecutorService executor;
    private RagOrchestrationService service;

    @BeforeEach
    void setUp() {
        partitionManager = mock(PartitionManager.class);
        vectorIndex = mock(VectorIndex.class);
        chatHistoryStore = mock(ChatHistoryStore.class);
        generationClient = mock(GenerationClient.class);
        strategyStages = mock(StrategyStages.class);
        executor = Executors.newFixedThreadPool(2);

        when(partitionManager.resolve("u1", "s1")).thenReturn(PARTITION);
        when(chatHistoryStore.getRecentMessages(eq("u1"), eq("s1"), anyInt())).thenReturn(List.of());

        StrategySelector strategySelector = new StrategySelector();
        service = new RagOrchestrationService(new QueryValidator(), partitionManager, vectorIndex, chatHistoryStore,
                new QueryClassifier(generationClient, new ObjectMapper()), strategySelector,
                new FallbackController(executor, strategySelector), strategyStages, generationClient);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void partitionHolds(long chunks, long pagesInScope) {
        when(vectorIndex.count(PARTITION, Map.of())).thenReturn(chunks, pagesInScope);
        when(vectorIndex.distinctValues(PARTITION, DocumentChunk.FILE_ID_KEY)).thenReturn(List.of("f1"));
    }

    @Nested
    @DisplayName("answerQuery()")
    class AnswerQuery {

        @Test
        @DisplayName("Empty partition asks for an upload without retrieving")
        void emptyPartitionPromptsUpload() {
            when(vectorIndex.count(PARTITION, Map.of())).thenReturn(0L);

            AnswerResponse response = service.answerQuery("What is on page 3?", "u1", "s1");

            assertTrue(response.success());
            assertEquals(RagConstants.UPLOAD_PROMPT_MESSAGE, response.answer());
            assertThat(response.sources()).isEmpty();
            assertEquals(AnswerOutcome.NO_DOCUMENTS, response.outcome());
            verify(vectorIndex, never()).query(any(), any(), anyInt(), anyMap());
            verify(strategyStages, never()).attempt(any(), anyInt(), any());
        }

        @Test
        @DisplayName("Fixed replies follow the language of the question")
        void uploadPromptInHindi() {
            when(vectorIndex.count(PARTITION, Map.of())).thenReturn(0L);

            AnswerResponse response = service.answerQuery("पृष्ठ तीन पर क्या लिखा है?", "u1", "s1");

            assertEquals(FixedMessage.UPLOAD_PROMPT.text(ResponseLanguage.HINDI), response.answer());
            assertEquals(AnswerOutcome.NO_DOCUMENTS, response.outcome());
            assertThat(response.reasoning()).contains("language hi");
        }

        @Test
        @DisplayName("Greeting is answered lexically")
        void greetingSkipsRetrieval() {
            when(vectorIndex.count(PARTITION, Map.of())).thenReturn(12L);

            AnswerResponse response = service.answerQuery("hi", "u1", "s1");

            assertEquals("GREETING", response.route());
            assertEquals(RagConstants.GREETING_REPLY, response.answer());
            assertEquals(AnswerOutcome.GREETING, response.outcome());
            assertThat(response.sources()).isEmpty();
            verify(strategyStages, never()).attempt(any(), anyInt(), any());
            verify(generationClient, never()).complete(anyList(), any());
        }

        @Test
        @DisplayName("Meta question without documents is answered directly")
        void metaQuestionWithoutDocuments() {
            when(vectorIndex.count(PARTITION, Map.of())).thenReturn(0L);
            when(generationClient.complete(anyList())).thenReturn("I answer questions about your uploaded documents.");

            AnswerResponse response = service.answerQuery("Who are you?", "u1", "s1");

            assertEquals("SIMPLE", response.route());
            assertEquals("I answer questions about your uploaded documents.", response.answer());
            assertEquals(AnswerOutcome.ANSWERED, response.outcome());
        }

        @Test
        @DisplayName("Retrieval failure in every strategy ends in the apology, never an exception")
        void retrievalFailureApologizes() {
            partitionHolds(40L, 40L);
            when(strategyStages.attempt(any(), anyInt(), any())).thenThrow(new VectorSearchException(PARTITION.partitionId(), "index down", null));

            AnswerResponse response = service.answerQuery("Summarize the contract terms", "u1", "s1");

            assertTrue(response.success());
            assertEquals(RagConstants.APOLOGY_MESSAGE, response.answer());
            assertEquals(AnswerOutcome.APOLOGY, response.outcome());
            assertThat(response.sources()).isEmpty();
            verify(strategyStages, times(2)).attempt(any(), anyInt(), any());
        }

        @Test
        @DisplayName("Small corpus starts at FULL_DOCUMENT and records both turns")
        void answersFromDocuments() {
            partitionHolds(10L, 10L);
            SourceCitation citation = new SourceCitation("report.pdf", 2, "revenue grew 12%");
            when(strategyStages.attempt(eq(Strategy.FULL_DOCUMENT), anyInt(), any())).thenReturn(StageResult.success(
                    new StrategyAnswer("Revenue grew 12%.", List.of(citation), Strategy.FULL_DOCUMENT, AnswerOutcome.ANSWERED, null)));

            AnswerResponse response = service.answerQuery("How much did revenue grow?", "u1", "s1");

            assertEquals("RAG", response.route());
            assertEquals("FULL_DOCUMENT", response.strategy());
            assertEquals(List.of(citation), response.sources());
            assertThat(response.reasoning()).contains("strategy FULL_DOCUMENT");

            ArgumentCaptor<ChatMessage> messages = ArgumentCaptor.forClass(ChatMessage.class);
            verify(chatHistoryStore, times(2)).appendMessage(eq("u1"), eq("s1"), messages.capture());
            assertThat(messages.getAllValues()).extracting(ChatMessage::role).containsExactly(ChatMessage.ROLE_USER, ChatMessage.ROLE_ASSISTANT);
            assertEquals(List.of(citation), messages.getAllValues().get(1).sources());
        }

        @Test
        @DisplayName("Mentioned files narrow the scope")
        void mentionedFilesNarrowScope() {
            when(vectorIndex.count(PARTITION, Map.of())).thenReturn(100L);
            when(vectorIndex.distinctValues(PARTITION, DocumentChunk.FILE_ID_KEY)).thenReturn(List.of("f1", "f2"));
            when(vectorIndex.count(PARTITION, Map.of(DocumentChunk.FILE_ID_KEY, List.of("f2")))).thenReturn(4L);
            when(strategyStages.attempt(any(), anyInt(), any())).thenReturn(StageResult.success(
                    new StrategyAnswer("Yes.", List.of(), Strategy.FULL_DOCUMENT, AnswerOutcome.ANSWERED, null)));

            AnswerResponse response = service.answerQuery(
                    new QueryRequest("Is it signed?", "u1", "s1", List.of("f2")));

            assertEquals("FULL_DOCUMENT", response.strategy());
            ArgumentCaptor<QueryScope> scope = ArgumentCaptor.forClass(QueryScope.class);
            verify(strategyStages).attempt(eq(Strategy.FULL_DOCUMENT), anyInt(), scope.capture());
            assertEquals(List.of("f2"), scope.getValue().fileIds());
            assertEquals(Map.of(DocumentChunk.FILE_ID_KEY, List.of("f2")), scope.getValue().filter());
        }

        @Test
        @DisplayName("Mentioned files outside the session are dropped from the scope")
        void foreignMentionsAreDropped() {
            when(vectorIndex.count(PARTITION, Map.of())).thenReturn(100L);
            when(vectorIndex.distinctValues(PARTITION, DocumentChunk.FILE_ID_KEY)).thenReturn(List.of("f1", "f2"));
            when(vectorIndex.count(PARTITION, Map.of(DocumentChunk.FILE_ID_KEY, List.of("f1")))).thenReturn(5L);
            when(strategyStages.attempt(any(), anyInt(), any())).thenReturn(StageResult.success(
                    new StrategyAnswer("Yes.", List.of(), Strategy.FULL_DOCUMENT, AnswerOutcome.ANSWERED, null)));

            AnswerResponse response = service.answerQuery(
                    new QueryRequest("Is it signed?", "u1", "s1", List.of("f1", "other-session-file")));

            ArgumentCaptor<QueryScope> scope = ArgumentCaptor.forClass(QueryScope.class);
            verify(strategyStages).attempt(eq(Strategy.FULL_DOCUMENT), anyInt(), scope.capture());
            assertEquals(List.of("f1"), scope.getValue().fileIds());
            assertEquals(Map.of(DocumentChunk.FILE_ID_KEY, List.of("f1")), scope.getValue().filter());
            assertThat(response.reasoning()).contains("ignored 1 mentioned files outside the session");
        }

        @Test
        void ownedFilesKeepMentionOrderWithoutDuplicates() {
            assertEquals(List.of(), RagOrchestrationService.ownedFiles(List.of("x", "y"), List.of("f1")));
            assertEquals(List.of("f2", "f1"), RagOrchestrationService.ownedFiles(List.of("f2", "x", "f1", "f2"), List.of("f1", "f2")));
        }

        @Test
        void invalidInputIsRejected() {
            AnswerResponse response = service.answerQuery("   ", "u1", "s1");

            assertFalse(response.success());
            assertEquals(AnswerOutcome.INVALID, response.outcome());
            assertEquals("query is required", response.error());
            verify(partitionManager, never()).resolve(anyString(), anyString());
            assertEquals(0, service.getQueryCount());
        }

        @Test
        void partitionFailureIsServiceUnavailable() {
            when(partitionManager.resolve("u1", "s1")).thenThrow(new PartitionUnavailableException("u1", "s1", null));

            AnswerResponse response = service.answerQuery("What is the deadline?", "u1", "s1");

            assertFalse(response.success());
            assertEquals(AnswerOutcome.SERVICE_UNAVAILABLE, response.outcome());
            assertEquals(RagConstants.SERVICE_UNAVAILABLE_MESSAGE, response.answer());
        }

        @Test
        void historyFailureDoesNotBlockTheAnswer() {
            when(chatHistoryStore.getRecentMessages(eq("u1"), eq("s1"), anyInt())).thenThrow(new IllegalStateException("mongo down"));
            when(vectorIndex.count(PARTITION, Map.of())).thenReturn(5L);

            AnswerResponse response = service.answerQuery("thanks", "u1", "s1");

            assertEquals(RagConstants.THANKS_REPLY, response.answer());
        }
    }

    @Nested
    @DisplayName("streamAnswerQuery()")
    class Stream {

        @Test
        void streamsLayersTextSourcesThenDone() {
            partitionHolds(10L, 10L);
            SourceCitation citation = new SourceCitation("notes.pdf", 1, "the meeting is on Friday");
            when(strategyStages.attempt(any(), anyInt(), any())).thenReturn(StageResult.success(
                    new StrategyAnswer("The meeting is on Friday.", List.of(citation), Strategy.FULL_DOCUMENT, AnswerOutcome.ANSWERED, null)));

            StepVerifier.create(service.streamAnswerQuery("When is the meeting?", "u1", "s1"))
                    .expectNext(AnswerStreamEvent.layer("classifying"))
                    .expectNext(AnswerStreamEvent.layer("RAG"))
                    .expectNext(AnswerStreamEvent.textDelta("The meeting is "))
                    .expectNext(AnswerStreamEvent.textDelta("on Friday."))
                    .expectNext(AnswerStreamEvent.source(citation))
                    .expectNext(AnswerStreamEvent.done())
                    .verifyComplete();
        }

        @Test
        void invalidInputEndsWithSingleError() {
            StepVerifier.create(service.streamAnswerQuery("", "u1", "s1"))
                    .expectNext(AnswerStreamEvent.error("query is required"))
                    .verifyComplete();
        }

        @Test
        void unavailablePartitionEndsWithError() {
            when(partitionManager.resolve("u1", "s1")).thenThrow(new PartitionUnavailableException("u1", "s1", null));

            StepVerifier.create(service.streamAnswerQuery("What changed?", "u1", "s1"))
                    .expectNext(AnswerStreamEvent.layer("classifying"))
                    .expectNext(AnswerStreamEvent.error(RagConstants.SERVICE_UNAVAILABLE_MESSAGE))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("answerQuery() through the real strategy stages")
    class ThroughStages {

        private DocumentStore documentStore;
        private RagOrchestrationService wired;

        @BeforeEach
        void wireStages() {
            documentStore = mock(DocumentStore.class);
            QueryEmbedder queryEmbedder = mock(QueryEmbedder.class);
            when(queryEmbedder.embedQuery(anyString())).thenReturn(new float[] {0.3f, 0.7f});
            RetrievalEngine retrievalEngine = new RetrievalEngine(queryEmbedder, vectorIndex);
            ReflectionTestUtils.setField(retrievalEngine, "defaultTopK", 8);
            ReflectionTestUtils.setField(retrievalEngine, "similarityThreshold", 0.4);
            StrategySelector strategySelector = new StrategySelector();
            StrategyStages stages = new StrategyStages(retrievalEngine, new ScoreOrderReranker(), new ContextAssembler(),
                    mock(DecompositionEngine.class), strategySelector, documentStore, generationClient);
            wired = new RagOrchestrationService(new QueryValidator(), partitionManager, vectorIndex, chatHistoryStore,
                    new QueryClassifier(generationClient, new ObjectMapper()), strategySelector,
                    new FallbackController(executor, strategySelector), stages, generationClient);
        }

        @Test
        @DisplayName("Vector search outage on a large partition ends in the apology without sources")
        void vectorOutageApologizes() {
            when(vectorIndex.count(PARTITION, Map.of())).thenReturn(120L);
            when(vectorIndex.distinctValues(PARTITION, DocumentChunk.FILE_ID_KEY)).thenReturn(List.of("f1"));
            when(vectorIndex.query(eq(PARTITION), any(), anyInt(), anyMap()))
                    .thenThrow(new VectorSearchException(PARTITION.partitionId(), "index down", null));

            AnswerResponse response = wired.answerQuery("What is the notice period?", "u1", "s1");

            assertTrue(response.success());
            assertEquals(RagConstants.APOLOGY_MESSAGE, response.answer());
            assertEquals(AnswerOutcome.APOLOGY, response.outcome());
            assertThat(response.sources()).isEmpty();
            assertThat(response.reasoning()).contains("SMART_CHUNKING failed", "SIMPLE_RAG failed");
            verify(vectorIndex, times(2)).query(eq(PARTITION), any(), anyInt(), anyMap());
            verify(documentStore, never()).getPages(anyString(), anyString());
            verify(generationClient, never()).complete(anyList());
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("A Hindi question gets a Hindi answer instruction")
        void promptCarriesTheQueryLanguage() {
            when(vectorIndex.count(PARTITION, Map.of())).thenReturn(3L);
            when(vectorIndex.distinctValues(PARTITION, DocumentChunk.FILE_ID_KEY)).thenReturn(List.of("f1"));
            when(documentStore.getPages(PARTITION.partitionId(), "f1")).thenReturn(List.of(new DocumentPage(1, "अवधि दो वर्ष है।")));
            when(documentStore.getFileName(PARTITION.partitionId(), "f1")).thenReturn(Optional.of("anubandh.pdf"));
            when(generationClient.complete(anyList())).thenReturn("अनुबंध की अवधि दो वर्ष है।");

            AnswerResponse response = wired.answerQuery("अनुबंध की अवधि क्या है?", "u1", "s1");

            assertEquals("FULL_DOCUMENT", response.strategy());
            ArgumentCaptor<List<Message>> prompt = ArgumentCaptor.forClass(List.class);
            verify(generationClient).complete(prompt.capture());
            assertThat(prompt.getValue().get(0).getText()).contains("Respond in Hindi.");
        }

        @Test
        @DisplayName("A file id from another session never reaches the page store")
        void foreignFileIsNotRead() {
            when(vectorIndex.count(PARTITION, Map.of())).thenReturn(5L);
            when(vectorIndex.distinctValues(PARTITION, DocumentChunk.FILE_ID_KEY)).thenReturn(List.of("alice-file"));
            when(vectorIndex.count(PARTITION, Map.of(DocumentChunk.FILE_ID_KEY, List.of("alice-file")))).thenReturn(5L);
            when(documentStore.getPages(PARTITION.partitionId(), "alice-file")).thenReturn(List.of(new DocumentPage(1, "Alice's budget is 500.")));
            when(documentStore.getFileName(PARTITION.partitionId(), "alice-file")).thenReturn(Optional.of("budget.pdf"));
            when(generationClient.complete(anyList())).thenReturn("The budget is 500.");

            AnswerResponse response = wired.answerQuery(
                    new QueryRequest("What is the budget?", "u1", "s1", List.of("alice-file", "bob-file")));

            assertEquals("FULL_DOCUMENT", response.strategy());
            assertEquals("The budget is 500.", response.answer());
            assertThat(response.sources()).extracting(SourceCitation::fileName).containsOnly("budget.pdf");
            verify(documentStore, never()).getPages(anyString(), eq("bob-file"));
            verify(documentStore, never()).getFileName(anyString(), eq("bob-file"));
        }
    }
}
