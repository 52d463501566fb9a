package com.chambua.pricing.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Price uploads run on a single worker thread. Jobs queue behind each other, so two uploads never
 * diff and write the same catalog rows at the same time.
 */
@Configuration
@EnableAsync
public class AsyncIngestionConfig {

    @Bean(name = "priceIngestionExecutor")
    public ThreadPoolTaskExecutor priceIngestionExecutor(@Value("${pricing.ingestion.queue-capacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(1);
        exec.setMaxPoolSize(1);
        exec.setQueueCapacity(queueCapacity);
        exec.setThreadNamePrefix("PriceUpload-");
        exec.setWaitForTasksToCompleteOnShutdown(false);
        exec.initialize();
        return exec;
    }
}
