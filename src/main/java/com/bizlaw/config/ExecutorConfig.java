package com.bizlaw.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Separate pools for the jurisdiction branches, the federal per-domain fan-out and synthesis,
 * so a federal branch waiting on its sub-queries never starves the pool it runs on and a slow
 * model call never queues ahead of another query's searches.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    public static final String RESEARCH_EXECUTOR = "researchExecutor";
    public static final String FEDERAL_SEARCH_EXECUTOR = "federalSearchExecutor";
    public static final String SYNTHESIS_EXECUTOR = "synthesisExecutor";

    private final AdvisorProperties properties;

    /**
     * Direct handoff: every branch gets a thread straight away, up to the maximum. Past that the
     * coordinator runs the branch on the caller thread.
     */
    @Bean(name = RESEARCH_EXECUTOR)
    public ThreadPoolTaskExecutor researchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("research-");
        executor.initialize();
        return executor;
    }

    @Bean(name = FEDERAL_SEARCH_EXECUTOR)
    public ThreadPoolTaskExecutor federalSearchExecutor() {
        int concurrency = Math.max(1, properties.getSearch().getFederalConcurrency());
        log.info("Federal search fan-out capped at {} concurrent provider calls", concurrency);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("federal-search-");
        executor.initialize();
        return executor;
    }

    /**
     * Bounded model concurrency. Queued calls wait for a worker; their deadline starts once they run.
     */
    @Bean(name = SYNTHESIS_EXECUTOR)
    public ThreadPoolTaskExecutor synthesisExecutor() {
        int concurrency = Math.max(1, properties.getSynthesis().getMaxConcurrent());
        log.info("Synthesis capped at {} concurrent model calls", concurrency);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("synthesis-");
        executor.initialize();
        return executor;
    }
}
