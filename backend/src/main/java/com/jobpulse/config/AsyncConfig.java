package com.jobpulse.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. reconcile-executor is the worker pool behind the execution boundary: one event per task,
 * run to completion. Events of different jobs reconcile in parallel.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String RECONCILE_EXECUTOR = "reconcile-executor";

    @Bean(name = RECONCILE_EXECUTOR)
    public Executor reconcileExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(8);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(10_000);
        e.setThreadNamePrefix("reconcile-");
        e.initialize();
        return e;
    }
}
