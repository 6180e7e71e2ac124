package org.learningjava.brandlens.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    // ensembles are long and rate-limited upstream, keep the pool small
    @Bean(name = "applicationTaskExecutor")
    public TaskExecutor applicationTaskExecutor(@Value("${brandlens.jobs.pool-size:2}") int poolSize,
                                                @Value("${brandlens.jobs.queue-capacity:16}") int queueCapacity) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(poolSize);
        ex.setMaxPoolSize(poolSize);
        ex.setQueueCapacity(queueCapacity);
        ex.setThreadNamePrefix("ensemble-");
        ex.initialize();
        return ex;
    }
}
