package com.actionengine.agent.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools kept apart from the web pool.
 *
 * workflowTaskExecutor runs streamed workflow runs. A run holds its thread
 * for as long as the model and tools take, so the pool is sized by the
 * number of concurrently running threads rather than by request rate.
 * traceTaskExecutor only writes run traces.
 */
@Configuration
public class AsyncConfig {

    @Value("${engine.executor.core-size:4}")
    private int workflowCoreSize;

    @Value("${engine.executor.max-size:16}")
    private int workflowMaxSize;

    @Value("${engine.executor.queue-capacity:100}")
    private int workflowQueueCapacity;

    @Bean(name = "workflowTaskExecutor")
    public ThreadPoolTaskExecutor workflowTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workflowCoreSize);
        executor.setMaxPoolSize(workflowMaxSize);
        executor.setQueueCapacity(workflowQueueCapacity);
        executor.setThreadNamePrefix("workflow-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean(name = "traceTaskExecutor")
    public ThreadPoolTaskExecutor traceTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("trace-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
