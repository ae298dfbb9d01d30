package com.bmsedge.sellout.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@Configuration
@EnableTransactionManagement
public class ApplicationConfig {

    @Autowired
    private IngestionSettings settings;

    /**
     * Worker pool for whole-file processing. Each upload is one task.
     */
    @Bean(name = "ingestionExecutor")
    public ThreadPoolTaskExecutor ingestionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getWorkerPoolSize());
        executor.setMaxPoolSize(settings.getWorkerPoolSize());
        executor.setQueueCapacity(settings.getWorkerQueueCapacity());
        executor.setThreadNamePrefix("ingestion-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }

    /**
     * Separate pool for sheet reads so a timed-out read never starves the file workers.
     */
    @Bean(name = "sheetLoaderExecutor")
    public ThreadPoolTaskExecutor sheetLoaderExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getWorkerPoolSize());
        executor.setMaxPoolSize(settings.getWorkerPoolSize() * 2);
        executor.setThreadNamePrefix("sheet-loader-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
