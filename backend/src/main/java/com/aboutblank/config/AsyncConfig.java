package com.aboutblank.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for the concurrent reads behind a full sync.
 *
 * Bounded in threads and queue. When both are full the submitting request
 * thread runs the task itself instead of failing. The pool is shut down by
 * ConnectionPoolLifecycle after the web server has drained.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${app.sync.executor.core-pool-size:4}")
    private int corePoolSize;

    @Value("${app.sync.executor.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${app.sync.executor.queue-capacity:100}")
    private int queueCapacity;

    @Bean(name = "syncExecutor")
    public ThreadPoolTaskExecutor syncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("sync-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        // Full syncs still in flight during graceful shutdown must be able to submit.
        executor.setAcceptTasksAfterContextClose(true);
        executor.setPhase(ConnectionPoolLifecycle.PHASE + 1);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Sync executor configured: core={}, max={}, queue={}", corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }
}
