package com.example.taskorchestrator.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Thread pools of the engine.
 * <p>
 * - dispatchExecutor: one thread per execution slot, runs lock acquisition and job lifecycle
 * - handlerExecutor: runs handler calls so the dispatch thread can enforce the deadline
 * - taskScheduler: drives the @Scheduled loops and lock heartbeats
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private static final int SCHEDULER_BASE_POOL_SIZE = 6;

    private final OrchestratorProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor() {
        var slots = properties.getExecutionSlots();
        log.info("Creating dispatch executor with {} execution slots", slots);

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(slots);
        executor.setMaxPoolSize(slots);
        // Slots are bounded by ExecutionSlotPool; the queue only absorbs hand-off races
        executor.setQueueCapacity(slots);
        executor.setThreadNamePrefix("job-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getShutdownTimeout().toSeconds());
        executor.initialize();
        return executor;
    }

    @Bean(name = "handlerExecutor")
    public ThreadPoolTaskExecutor handlerExecutor() {
        var slots = properties.getExecutionSlots();

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(slots);
        // Headroom for handlers that ignore interruption after a timeout
        executor.setMaxPoolSize(slots * 2);
        executor.setQueueCapacity(slots);
        executor.setThreadNamePrefix("job-handler-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) properties.getShutdownTimeout().toSeconds());
        executor.initialize();
        return executor;
    }

    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(SCHEDULER_BASE_POOL_SIZE + Math.max(2, properties.getExecutionSlots() / 4));
        scheduler.setThreadNamePrefix("orchestrator-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds((int) properties.getShutdownTimeout().toSeconds());
        scheduler.initialize();
        return scheduler;
    }
}
