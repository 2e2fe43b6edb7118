package com.gradientcast.detection.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provides the "detectionExecutor" pool used by the batch service to evaluate
 * dimensions of one request in parallel. Sized by {@code detection.execution.parallelism}.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "detectionExecutor", destroyMethod = "shutdown")
    public ExecutorService detectionExecutor(DetectionProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getExecution().getParallelism(), r -> {
            Thread t = new Thread(r, "detection-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
