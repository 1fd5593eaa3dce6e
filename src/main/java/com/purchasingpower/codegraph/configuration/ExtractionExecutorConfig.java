package com.purchasingpower.codegraph.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded worker pool for per-file extraction.
 *
 * When the queue is full the submitting build thread runs the task itself,
 * so large trees throttle instead of failing.
 */
@Slf4j
@Configuration
public class ExtractionExecutorConfig {

    @Bean(name = "extractionExecutor")
    public ThreadPoolTaskExecutor extractionExecutor(CodeGraphProperties properties) {
        ExtractionProperties extraction = properties.getExtraction();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(extraction.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(extraction.getCorePoolSize(), extraction.getMaxPoolSize()));
        executor.setQueueCapacity(extraction.getQueueCapacity());
        executor.setThreadNamePrefix("graph-extract-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("Extraction executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                extraction.getQueueCapacity());

        return executor;
    }
}
