package com.tradecodes.classifier.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class TaskExecutorConfig {

    @Bean("retrievalExecutor")
    public TaskExecutor retrievalExecutor(@Value("${app.retrieval.executor.corePoolSize:5}") int corePoolSize,
                                          @Value("${app.retrieval.executor.maxPoolSize:8}") int maxPoolSize,
                                          @Value("${app.retrieval.executor.queueCapacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Math.max(corePoolSize, maxPoolSize));
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("Retrieval-");
        executor.initialize();
        return executor;
    }
}
