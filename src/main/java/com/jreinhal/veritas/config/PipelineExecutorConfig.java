package com.jreinhal.veritas.config;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
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
 * Thread pools for the blocking calls of the answer pipeline.
 *
 * <p>Store lookups, expansion variants and model calls each get their own bounded pool, sized
 * independently of request concurrency. A full pool fails the submission with
 * {@link RejectedExecutionException}; the task never runs on the caller thread.</p>
 */
@Configuration
public class PipelineExecutorConfig {
    private static final Logger log = LoggerFactory.getLogger(PipelineExecutorConfig.class);
    private static final int MIN_QUEUE_CAPACITY = 10;
    private static final long KEEP_ALIVE_SECONDS = 30L;

    public enum PipelinePool {
        RETRIEVAL("retrieval-exec-"),
        EXPANSION("expansion-exec-"),
        LLM("llm-exec-");

        private final String threadPrefix;

        PipelinePool(String threadPrefix) {
            this.threadPrefix = threadPrefix;
        }

        public String threadPrefix() {
            return this.threadPrefix;
        }
    }

    private final Map<PipelinePool, AtomicLong> rejections = new EnumMap<>(PipelinePool.class);

    public PipelineExecutorConfig() {
        for (PipelinePool pool : PipelinePool.values()) {
            this.rejections.put(pool, new AtomicLong());
        }
    }

    @Bean(name = {"retrievalExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor retrievalExecutor(
            @Value("${veritas.performance.retrieval-core-threads:4}") int coreThreads,
            @Value("${veritas.performance.retrieval-max-threads:16}") int maxThreads,
            @Value("${veritas.performance.retrieval-queue-capacity:200}") int queueCapacity) {
        return this.pool(PipelinePool.RETRIEVAL, coreThreads, maxThreads, queueCapacity);
    }

    /**
     * Expansion fans out up to a handful of searches per sub-query, so its queue scales with the
     * thread count.
     */
    @Bean(name = {"expansionExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor expansionExecutor(
            @Value("${veritas.performance.expansion-threads:8}") int threads) {
        return this.pool(PipelinePool.EXPANSION, threads, threads, Math.max(50, threads * 10));
    }

    @Bean(name = {"llmExecutor"}, destroyMethod = "shutdown")
    public ThreadPoolExecutor llmExecutor(
            @Value("${veritas.performance.llm-threads:8}") int threads,
            @Value("${veritas.performance.llm-queue-capacity:100}") int queueCapacity) {
        return this.pool(PipelinePool.LLM, threads, threads, queueCapacity);
    }

    public long rejectionCount(PipelinePool pool) {
        return this.rejections.get(pool).get();
    }

    private ThreadPoolExecutor pool(PipelinePool pool, int coreThreads, int maxThreads, int queueCapacity) {
        int core = Math.max(1, coreThreads);
        int max = Math.max(core, maxThreads);
        int queue = Math.max(MIN_QUEUE_CAPACITY, queueCapacity);
        AtomicInteger threadNumber = new AtomicInteger();
        AtomicLong rejected = this.rejections.get(pool);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(core, max, KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queue),
                runnable -> {
                    Thread thread = new Thread(runnable, pool.threadPrefix() + threadNumber.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                (task, saturated) -> {
                    long total = rejected.incrementAndGet();
                    log.warn("{} pool saturated ({} active, {} queued), rejected task #{}",
                            pool, saturated.getActiveCount(), saturated.getQueue().size(), total);
                    throw new RejectedExecutionException(pool + " pool saturated");
                });
        executor.allowCoreThreadTimeOut(true);
        log.info("{} pool ready: threads={}..{}, queue={}", pool, core, max, queue);
        return executor;
    }
}
