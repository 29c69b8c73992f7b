package com.capitalallocator.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Pool that runs accounts of an allocation batch in parallel. Each account is still processed by
 * one writer at a time under its ledger lock, so the pool size only bounds how many accounts move
 * at once.
 *
 * <p>When the queue is full the submitting thread runs the account itself: a batch slows down
 * rather than dropping accounts.
 */
@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Value("${allocator.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${allocator.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${allocator.async.queue-capacity:100}")
    private int queueCapacity;

    @Bean("allocationExecutor")
    public ThreadPoolTaskExecutor allocationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("allocation-");
        executor.setRejectedExecutionHandler((task, pool) -> {
            log.warn(
                    "Allocation pool saturated ({} active, {} queued); running account on the caller",
                    pool.getActiveCount(),
                    pool.getQueue().size());
            new ThreadPoolExecutor.CallerRunsPolicy().rejectedExecution(task, pool);
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
