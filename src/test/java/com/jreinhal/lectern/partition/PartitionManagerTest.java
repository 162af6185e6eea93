package com.jreinhal.lectern.partition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.lectern.exception.PartitionUnavailableException;
import com.jreinhal.lectern.model.ChatSession;
import com.jreinhal.lectern.store.ChatHistoryStore;
import com.jreinhal.lectern.vector.PartitionHandle;
import com.jreinhal.lectern.vector.VectorIndex;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

class PartitionManagerTest {

    private ChatHistoryStore chatHistoryStore;
    private VectorIndex vectorIndex;
    private PartitionManager manager;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        chatHistoryStore = mock(ChatHistoryStore.class);
        vectorIndex = mock(VectorIndex.class);
        when(chatHistoryStore.bindPartition(anyString(), anyString(), anyString())).thenAnswer(inv -> inv.getArgument(2));
        when(vectorIndex.createOrGet(anyString())).thenAnswer(inv -> new PartitionHandle(inv.getArgument(0), inv.getArgument(0)));
        PartitionCache cache = new CaffeinePartitionCache(Caffeine.newBuilder().<String, PartitionHandle>build());
        manager = new PartitionManager(cache, chatHistoryStore, vectorIndex);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    @Test
    void sameSessionResolvesToSamePartition() {
        String first = manager.getOrCreatePartition("alice", "s1");
        String second = manager.getOrCreatePartition("alice", "s1");

        assertThat(second).isEqualTo(first);
        verify(vectorIndex, times(1)).createOrGet(first);
    }

    @Test
    void differentSessionsAndUsersGetDifferentPartitions() {
        String a = manager.getOrCreatePartition("alice", "s1");
        String b = manager.getOrCreatePartition("alice", "s2");
        String c = manager.getOrCreatePartition("bob", "s1");

        assertThat(List.of(a, b, c)).doesNotHaveDuplicates();
    }

    @Test
    void storedBindingWins() {
        when(chatHistoryStore.bindPartition(eq("alice"), eq("s1"), anyString())).thenReturn("chat_existing");

        assertThat(manager.getOrCreatePartition("alice", "s1")).isEqualTo("chat_existing");
        verify(vectorIndex).createOrGet("chat_existing");
    }

    @Test
    void concurrentFirstAccessCreatesOnce() throws Exception {
        pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> futures = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            Callable<String> task = () -> {
                start.await();
                return manager.getOrCreatePartition("alice", "race");
            };
            futures.add(pool.submit(task));
        }
        start.countDown();

        String expected = PartitionNames.partitionId("alice", "race");
        for (Future<String> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(expected);
        }
        verify(vectorIndex, times(1)).createOrGet(expected);
        verify(chatHistoryStore, times(1)).bindPartition("alice", "race", expected);
    }

    @Test
    void storeFailureSurfacesAsPartitionUnavailable() {
        when(chatHistoryStore.bindPartition(eq("alice"), eq("down"), anyString()))
                .thenThrow(new DataAccessResourceFailureException("mongo down"));

        assertThatThrownBy(() -> manager.resolve("alice", "down"))
                .isInstanceOf(PartitionUnavailableException.class);
    }

    @Test
    void failedCreationIsRetriedOnNextRequest() {
        when(vectorIndex.createOrGet(anyString()))
                .thenThrow(new DataAccessResourceFailureException("blip"))
                .thenAnswer(inv -> new PartitionHandle(inv.getArgument(0), inv.getArgument(0)));

        assertThatThrownBy(() -> manager.resolve("alice", "s1")).isInstanceOf(PartitionUnavailableException.class);
        assertThat(manager.resolve("alice", "s1").partitionId()).isEqualTo(PartitionNames.partitionId("alice", "s1"));
    }

    @Test
    void deleteDropsCollectionAndForgetsHandle() {
        String partitionId = manager.getOrCreatePartition("alice", "s1");
        when(chatHistoryStore.findSession("alice", "s1"))
                .thenReturn(Optional.of(new ChatSession("id", "alice", "s1", partitionId, List.of(), Instant.now(), Instant.now())));

        manager.deletePartition("alice", "s1");
        manager.getOrCreatePartition("alice", "s1");

        verify(vectorIndex).deleteCollection(partitionId);
        verify(vectorIndex, times(2)).createOrGet(partitionId);
    }
}
