package com.loanmatch.matching.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: matching-worker-executor runs orchestrator loops (runs of several batches queue FIFO);
 * escalation-executor is sized to the judgment service's concurrency cap.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String MATCHING_WORKER_EXECUTOR = "matching-worker-executor";
    public static final String ESCALATION_EXECUTOR = "escalation-executor";

    @Bean(name = MATCHING_WORKER_EXECUTOR)
    public Executor matchingWorkerExecutor(MatchingProperties matchingProperties) {
        int workers = Math.max(1, matchingProperties.getWorkers());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(workers);
        e.setMaxPoolSize(workers);
        e.setThreadNamePrefix("matching-");
        e.initialize();
        return e;
    }

    @Bean(name = ESCALATION_EXECUTOR)
    public Executor escalationExecutor(EscalationProperties escalationProperties) {
        int cap = Math.max(1, escalationProperties.getMaxConcurrentCalls());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(cap);
        e.setMaxPoolSize(cap);
        e.setThreadNamePrefix("escalation-");
        e.initialize();
        return e;
    }
}
