package uk.gegc.puzzlemaker.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pools for model calls (bounded by a hard timeout) and batch generation.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${async.ai.core-pool-size:4}")
    private int aiCorePoolSize;

    @Value("${async.ai.max-pool-size:8}")
    private int aiMaxPoolSize;

    @Value("${async.ai.queue-capacity:50}")
    private int aiQueueCapacity;

    @Value("${puzzle.generation.batch-concurrency:2}")
    private int batchConcurrency;

    /**
     * Runs backend calls so the caller can cancel them after the per-call timeout.
     * A saturated pool rejects new calls instead of running them on the caller's thread.
     */
    @Bean(name = "aiTaskExecutor")
    public AsyncTaskExecutor aiTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(aiCorePoolSize);
        executor.setMaxPoolSize(aiMaxPoolSize);
        executor.setQueueCapacity(aiQueueCapacity);
        executor.setThreadNamePrefix("ai-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("AI task executor configured: core={}, max={}, queue={}",
                aiCorePoolSize, aiMaxPoolSize, aiQueueCapacity);
        return executor;
    }

    /**
     * One thread per concurrently generated batch item; extra items queue
     */
    @Bean(name = "puzzleBatchExecutor")
    public Executor puzzleBatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(batchConcurrency);
        executor.setMaxPoolSize(batchConcurrency);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("puzzle-batch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("Puzzle batch executor configured: concurrency={}", batchConcurrency);
        return executor;
    }
}
