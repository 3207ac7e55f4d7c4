package io.github.jakubt4.pmfusion.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Bounded pool running the per-frame transformations of one iteration.
 */
@Slf4j
@Configuration
public class WorkerPoolConfig {

    @Bean(destroyMethod = "shutdown")
    ExecutorService frameWorkerPool(final AlignmentProperties properties) {
        final var threads = properties.getWorkerThreads() > 0
                ? properties.getWorkerThreads()
                : Runtime.getRuntime().availableProcessors();
        final var threadFactory = new CustomizableThreadFactory("frame-worker-");
        threadFactory.setDaemon(true);
        log.info("Frame worker pool started with {} threads", threads);
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}
