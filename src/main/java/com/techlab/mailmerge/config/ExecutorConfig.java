package com.techlab.mailmerge.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool used to render batch rows.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    @Bean(name = "renderExecutor")
    public ThreadPoolTaskExecutor renderExecutor(@Value("${mailmerge.batch.worker-count:2}") int workerCount) {
        int poolSize = Math.max(1, workerCount);
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("render-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        log.info("Render executor started with {} workers", poolSize);
        return executor;
    }
}
