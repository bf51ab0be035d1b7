package com.zerotrust.access.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded pool for batch session reevaluation. When the queue is full new work is
 * rejected and the batch counts the session as failed.
 */
@Slf4j
@Configuration
public class ReevaluationExecutorConfig {

    @Value("${zerotrust.session.executor.core-size:4}")
    private int coreSize;

    @Value("${zerotrust.session.executor.max-size:8}")
    private int maxSize;

    @Value("${zerotrust.session.executor.queue-capacity:1000}")
    private int queueCapacity;

    @Bean(name = "reevaluationExecutor")
    public ThreadPoolTaskExecutor reevaluationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("session-reeval-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Reevaluation executor: core={}, max={}, queue={}", coreSize, maxSize, queueCapacity);
        return executor;
    }
}
