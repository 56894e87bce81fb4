package com.memoryengine.config;

import com.memoryengine.ifmemory.IfMemoryEngineConfig;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools of the IF-memory engine.
 *
 * <p>{@code ifMemoryTaskScheduler} runs one fixed-rate task per enabled IF memory.
 * {@code liveStoreExecutor} runs the time-limited live store calls so that a slow
 * Redis answer blocks a pool thread instead of the instance's timer thread.
 */
@Configuration
@EnableConfigurationProperties(IfMemoryEngineConfig.class)
public class SchedulerConfig {

    @Value("${memory-engine.live-store.core-pool-size:4}")
    private int liveStoreCorePoolSize;

    @Value("${memory-engine.live-store.max-pool-size:16}")
    private int liveStoreMaxPoolSize;

    @Value("${memory-engine.live-store.queue-capacity:500}")
    private int liveStoreQueueCapacity;

    @Bean("ifMemoryTaskScheduler")
    public ThreadPoolTaskScheduler ifMemoryTaskScheduler(IfMemoryEngineConfig ifMemoryEngineConfig) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(ifMemoryEngineConfig.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("if-memory-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        return scheduler;
    }

    @Bean("liveStoreExecutor")
    public ThreadPoolTaskExecutor liveStoreExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(liveStoreCorePoolSize);
        executor.setMaxPoolSize(liveStoreMaxPoolSize);
        executor.setQueueCapacity(liveStoreQueueCapacity);
        executor.setThreadNamePrefix("live-store-");
        // Running on the caller would escape the time limit
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
