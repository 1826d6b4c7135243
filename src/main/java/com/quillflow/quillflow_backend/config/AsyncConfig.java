package com.quillflow.quillflow_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Executors for background work. Whole tasks, individual provider calls, store writes and
 * SSE pumps each get their own pool; a long-lived stream never takes a thread a write needs.
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor(PipelineProperties properties) {
        PipelineProperties.Execution cfg = properties.getExecution();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getCorePoolSize());
        executor.setMaxPoolSize(cfg.getMaxPoolSize());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "providerCallExecutor")
    public Executor providerCallExecutor(PipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecution().getMaxPoolSize());
        executor.setMaxPoolSize(properties.getExecution().getMaxPoolSize() * 2);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("provider-call-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "ioExecutor")
    public Executor ioExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("pipeline-io-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "streamExecutor")
    public Executor streamExecutor(PipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(properties.getStreaming().getMaxConcurrentStreams());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("pipeline-sse-");
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
