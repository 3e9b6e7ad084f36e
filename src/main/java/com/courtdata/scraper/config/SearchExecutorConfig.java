package com.courtdata.scraper.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool running search orchestrations. Each worker owns at most one
 * browser session at a time, so the pool size caps concurrent browsers.
 */
@Configuration
public class SearchExecutorConfig {

    @Bean(name = "searchExecutor")
    public ThreadPoolTaskExecutor searchExecutor(final SearchProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getWorkers());
        executor.setMaxPoolSize(props.getWorkers());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix("court-search-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
