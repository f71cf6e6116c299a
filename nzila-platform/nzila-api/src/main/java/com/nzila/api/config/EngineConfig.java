package com.nzila.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure for the action engine: the clock every timestamp comes from
 * and the worker pool tool adapters run on.
 */
@Configuration
@EnableScheduling
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Tool adapters run here so a hung tool can be abandoned after the execution timeout.
     */
    @Bean(name = "toolExecutor", destroyMethod = "shutdownNow")
    public ExecutorService toolExecutor(@Value("${nzila.execution.worker-threads:8}") int workerThreads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "nzila-tool-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(workerThreads, threadFactory);
    }
}
