package com.di.flightwarehouse.config;

import com.di.flightwarehouse.pipeline.RetryPolicy;
import com.di.flightwarehouse.util.MdcPropagation;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stage execution infrastructure: the bounded pool for stages that may run side by side, and the
 * per-stage retry policy. Every pooled task carries the submitting thread's MDC ({@code runId}, {@code stage}).
 */
@Configuration
public class PipelineExecutorConfig {

    @Bean(name = "stageExecutor", destroyMethod = "shutdown")
    public ExecutorService stageExecutor(PipelineProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(properties.getParallelism(), r -> {
            Thread t = new Thread(r, "pipeline-stage-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        return MdcPropagation.wrapExecutor(pool);
    }

    @Bean
    public RetryPolicy stageRetryPolicy(PipelineProperties properties) {
        return new RetryPolicy(properties.getMaxRetries(), properties.getRetryBackoff());
    }
}
