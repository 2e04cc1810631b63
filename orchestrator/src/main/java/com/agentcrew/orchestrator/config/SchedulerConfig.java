package com.agentcrew.orchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SchedulerConfig {

    /** Single time source for reservations, scoring and stage timestamps. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs whole pipelines, one per thread. A fixed pool caps how many units
     * talk to the code-generation engine at once.
     */
    @Bean(name = "pipelineExecutor", destroyMethod = "shutdown")
    public ExecutorService pipelineExecutor(@Value("${agentcrew.pipeline.workers:4}") int workers) {
        return Executors.newFixedThreadPool(workers);
    }
}
