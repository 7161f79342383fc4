package com.multila.backend.global.config;

import java.util.concurrent.ThreadPoolExecutor;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Maintenance jobs run on the scheduler; export generation runs on its own bounded pool.
 */
@Configuration
@EnableScheduling
public class TaskExecutionConfig {

    public static final String EXPORT_TASK_EXECUTOR = "exportTaskExecutor";

    @Bean(name = EXPORT_TASK_EXECUTOR)
    public TaskExecutor exportTaskExecutor(
            @Value("${multila.export.worker-threads:2}") int workerThreads,
            @Value("${multila.export.queue-capacity:100}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("export-");
        executor.setCorePoolSize(workerThreads);
        executor.setMaxPoolSize(workerThreads);
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
