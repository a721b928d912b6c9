package com.aastreli.modelengine.config;

import com.aastreli.modelengine.domain.service.retraining.RetrainingProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class RetrainingExecutorConfig {

    @Bean(name = "retrainExecutor")
    public ThreadPoolTaskExecutor retrainExecutor(RetrainingProperties properties) {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setThreadNamePrefix("retrain-");
        exec.setCorePoolSize(properties.getWorkerThreads());
        exec.setMaxPoolSize(properties.getWorkerThreads());
        exec.setQueueCapacity(properties.getQueueCapacity());
        exec.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        exec.setWaitForTasksToCompleteOnShutdown(true);
        exec.setAwaitTerminationSeconds(30);
        exec.initialize();
        return exec;
    }
}
