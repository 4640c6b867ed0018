package com.example.taskorchestrator.config;

import com.example.taskorchestrator.domain.enums.JobStatus;
import com.example.taskorchestrator.domain.repository.JobRepository;
import com.example.taskorchestrator.service.executor.ExecutionSlotPool;
import com.example.taskorchestrator.service.queue.SchedulingQueue;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Metrics for engine health and performance.
 * <p>
 * Exposes Prometheus metrics for:
 * - Jobs by status, queue depth and slot usage
 * - Lock acquisition outcomes
 * - Job execution time and dispatch latency
 * - Failures, retries and exhausted retries
 * <p>
 * Also keeps the in-process aggregates reported by the engine health operation.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final JobRepository jobRepository;
    private final SchedulingQueue schedulingQueue;
    private final ExecutionSlotPool slotPool;

    private final Map<JobStatus, AtomicLong> jobCounts = new ConcurrentHashMap<>();

    private final LongAdder lockAttempts = new LongAdder();
    private final LongAdder lockDenials = new LongAdder();
    private final LongAdder dispatchCount = new LongAdder();
    private final LongAdder dispatchLatencyTotalMs = new LongAdder();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : JobStatus.values()) {
            var counter = new AtomicLong(0);
            jobCounts.put(status, counter);

            Gauge.builder("task_orchestrator_jobs", counter, AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of jobs by status")
                    .register(meterRegistry);
        }

        Gauge.builder("task_orchestrator_queue_depth", schedulingQueue, SchedulingQueue::size)
                .description("Entries waiting in the in-memory scheduling queue")
                .register(meterRegistry);

        Gauge.builder("task_orchestrator_slots_in_use", slotPool, ExecutionSlotPool::inUse)
                .description("Execution slots currently occupied on this worker")
                .register(meterRegistry);
    }

    /**
     * Periodically update job gauges from the database
     */
    @Scheduled(fixedDelayString = "${task-orchestrator.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            for (var status : JobStatus.values()) {
                jobCounts.get(status).set(jobRepository.countByStatus(status));
            }
        } catch (DataAccessException e) {
            log.warn("Could not refresh job metrics: {}", e.getMessage());
        }
    }

    public void incrementCounter(String name, String... tags) {
        meterRegistry.counter("task_orchestrator_" + name, tags).increment();
    }

    public Timer.Sample startJobExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordJobExecution(Timer.Sample sample, String taskType, String outcome) {
        sample.stop(Timer.builder("task_orchestrator_execution_time")
                .tag("task_type", taskType)
                .tag("outcome", outcome)
                .description("Handler execution time")
                .register(meterRegistry));
    }

    public void recordLockAttempt(boolean acquired) {
        lockAttempts.increment();
        if (!acquired) {
            lockDenials.increment();
        }
        meterRegistry.counter("task_orchestrator_lock_attempts", "outcome", acquired ? "acquired" : "denied").increment();
    }

    /**
     * Time between when a job was due and when it started
     */
    public void recordDispatchLatency(Duration latency) {
        var ms = Math.max(0, latency.toMillis());
        dispatchCount.increment();
        dispatchLatencyTotalMs.add(ms);
        meterRegistry.timer("task_orchestrator_dispatch_latency").record(Duration.ofMillis(ms));
    }

    public void recordJobFailure(String taskType, String classification) {
        meterRegistry.counter("task_orchestrator_failures",
                "task_type", taskType != null ? taskType : "unknown",
                "classification", classification != null ? classification : "unknown"
        ).increment();
    }

    public void recordRetry(String taskType, int attemptNumber) {
        meterRegistry.counter("task_orchestrator_retries",
                "task_type", taskType != null ? taskType : "unknown",
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordRetryExhausted(String taskType) {
        meterRegistry.counter("task_orchestrator_retries_exhausted",
                "task_type", taskType != null ? taskType : "unknown"
        ).increment();
    }

    /**
     * Share of lock acquisitions on this worker that were denied, 0 when none were attempted
     */
    public double getLockContentionRate() {
        var attempts = lockAttempts.sum();
        return attempts == 0 ? 0.0 : (double) lockDenials.sum() / attempts;
    }

    public double getAverageDispatchLatencyMs() {
        var count = dispatchCount.sum();
        return count == 0 ? 0.0 : (double) dispatchLatencyTotalMs.sum() / count;
    }
}
