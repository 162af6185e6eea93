package com.jreinhal.lectern.config;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools for the answer pipeline.
 *
 * <p>{@code ragExecutor} runs strategy stages so the caller can wait on each with a
 * timeout. {@code subQueryExecutor} runs decomposition sub-queries, which are submitted
 * from stages running on {@code ragExecutor} and must not queue behind them.
 * {@code externalCallExecutor} carries single embedding and generation calls so each
 * can be awaited with its own timeout.</p>
 *
 * <p>A full pool throws {@link RejectedExecutionException} instead of running the task on
 * the submitting thread; the pipeline treats that as overload and answers with an apology.</p>
 */
@Configuration
public class RagPerformanceConfig {
    private static final Logger log = LoggerFactory.getLogger(RagPerformanceConfig.class);
    private static final long KEEP_ALIVE_SECONDS = 30L;
    private static final int MIN_QUEUE_CAPACITY = 10;
    private static final int MIN_SUB_QUERY_QUEUE = 50;

    @Bean(name = {"ragExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor ragExecutor(
            @Value("${lectern.performance.rag-core-threads:8}") int coreThreads,
            @Value("${lectern.performance.rag-max-threads:16}") int maxThreads,
            @Value("${lectern.performance.rag-queue-capacity:200}") int queueCapacity) {
        return newPool("rag-exec-", PoolLimits.of(coreThreads, maxThreads, queueCapacity));
    }

    @Bean(name = {"subQueryExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor subQueryExecutor(
            @Value("${lectern.performance.sub-query-threads:4}") int threads) {
        return newPool("subquery-exec-", PoolLimits.of(threads, threads, Math.max(MIN_SUB_QUERY_QUEUE, threads * 10)));
    }

    @Bean(name = {"externalCallExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor externalCallExecutor(
            @Value("${lectern.performance.external-core-threads:8}") int coreThreads,
            @Value("${lectern.performance.external-max-threads:32}") int maxThreads,
            @Value("${lectern.performance.external-queue-capacity:400}") int queueCapacity) {
        return newPool("external-call-", PoolLimits.of(coreThreads, maxThreads, queueCapacity));
    }

    private static ThreadPoolExecutor newPool(String prefix, PoolLimits limits) {
        ThreadPoolExecutor pool = new ThreadPoolExecutor(limits.core(), limits.max(), KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(limits.queue()), new PrefixedThreadFactory(prefix), new MonitoredRejectionHandler(prefix));
        pool.allowCoreThreadTimeOut(true);
        log.info("Pool {} ready ({} core / {} max threads, {} queued tasks)", prefix, limits.core(), limits.max(), limits.queue());
        return pool;
    }

    /**
     * Configured sizes clamped to at least one core thread, {@code max >= core} and a
     * queue of at least {@value #MIN_QUEUE_CAPACITY}.
     */
    record PoolLimits(int core, int max, int queue) {
        static PoolLimits of(int coreThreads, int maxThreads, int queueCapacity) {
            int core = Math.max(1, coreThreads);
            return new PoolLimits(core, Math.max(core, maxThreads), Math.max(MIN_QUEUE_CAPACITY, queueCapacity));
        }
    }

    public static final class MonitoredRejectionHandler implements RejectedExecutionHandler {
        private final String pool;
        private final AtomicLong rejected = new AtomicLong();

        public MonitoredRejectionHandler(String pool) {
            this.pool = pool;
        }

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            long total = this.rejected.incrementAndGet();
            log.warn("Pool {} saturated: active={} size={} queued={} (rejection #{})",
                    this.pool, executor.getActiveCount(), executor.getPoolSize(), executor.getQueue().size(), total);
            throw new RejectedExecutionException("Pool " + this.pool + " is saturated");
        }

        public long getRejectionCount() {
            return this.rejected.get();
        }
    }

    private static final class PrefixedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger sequence = new AtomicInteger();

        private PrefixedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread worker = new Thread(task, this.prefix + this.sequence.incrementAndGet());
            worker.setDaemon(true);
            return worker;
        }
    }
}
