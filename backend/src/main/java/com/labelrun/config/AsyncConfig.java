package com.labelrun.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. classification-executor runs the batches of one chunk; the orchestrator thread blocks on the
 * chunk barrier, so the pool only needs max-parallel threads.
 */
@Configuration
public class AsyncConfig {

    public static final String CLASSIFICATION_EXECUTOR = "classification-executor";

    @Bean(name = CLASSIFICATION_EXECUTOR)
    public Executor classificationExecutor(@Value("${labelrun.classifier.max-parallel:1}") int maxParallel) {
        int threads = Math.max(1, maxParallel);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix("classify-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.initialize();
        return e;
    }
}
