package com.logimatrix.tracking.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the engine.
 *
 * - ingestionExecutor: drains per-vehicle lanes. One lane runs on at most one
 *   thread at a time, so a vehicle's fixes never interleave.
 * - evaluationExecutor: runs the geofence and accident engines side by side for one fix.
 * - trackingIoExecutor: carries store and log writes so the caller can enforce a deadline.
 * - busDispatchExecutor: drains subscriber buffers; a slow subscriber only occupies
 *   one of its threads.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    @Bean("ingestionExecutor")
    public Executor ingestionExecutor(TrackingProperties properties) {
        int workers = Math.max(1, properties.getIngest().getWorkerPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        // Lanes are scheduled once each, so the queue only holds one entry per busy vehicle
        executor.setQueueCapacity(100_000);
        executor.setThreadNamePrefix("ingest-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean("evaluationExecutor")
    public Executor evaluationExecutor(TrackingProperties properties) {
        int workers = Math.max(2, properties.getIngest().getWorkerPoolSize());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers * 2);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("evaluate-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean("trackingIoExecutor")
    public Executor trackingIoExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(16);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("tracking-io-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean("busDispatchExecutor")
    public Executor busDispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(50_000);
        executor.setThreadNamePrefix("bus-dispatch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
