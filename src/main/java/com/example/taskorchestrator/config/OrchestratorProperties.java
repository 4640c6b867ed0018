package com.example.taskorchestrator.config;

import com.example.taskorchestrator.domain.enums.BackoffType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the orchestration engine.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "task-orchestrator")
public class OrchestratorProperties {

    /**
     * Turns the background polling, dispatch and maintenance loops on or off
     */
    private boolean schedulingEnabled = true;

    /**
     * Interval in milliseconds between reads of due triggers and pending jobs from the store
     */
    @Min(100)
    private long pollIntervalMs = 2000;

    /**
     * Interval in milliseconds between attempts to move ready heap entries into free slots
     */
    @Min(10)
    private long dispatchIntervalMs = 250;

    /**
     * Maximum number of triggers and of pending jobs read per poll cycle
     */
    @Min(1)
    private int pollBatchSize = 500;

    /**
     * Concurrently running jobs per worker
     */
    @Min(1)
    private int executionSlots = 10;

    /**
     * Lifetime of an execution lock before it expires unless extended
     */
    @NotNull
    private Duration lockTtl = Duration.ofSeconds(60);

    @NotNull
    private Duration lockHeartbeatInterval = Duration.ofSeconds(20);

    /**
     * Used when a trigger has no max execution duration of its own
     */
    @NotNull
    private Duration defaultMaxExecution = Duration.ofHours(1);

    @Min(1000)
    private long reconciliationIntervalMs = 30000;

    /**
     * How long past its deadline a running job is tolerated before the sweep fails it
     */
    @NotNull
    private Duration reconciliationGrace = Duration.ofSeconds(60);

    @Min(1000)
    private long lockPurgeIntervalMs = 300000;

    @Min(1000)
    private long workerHeartbeatIntervalMs = 15000;

    /**
     * Workers without a heartbeat for this long are not counted as active
     */
    @NotNull
    private Duration workerStaleThreshold = Duration.ofSeconds(60);

    /**
     * Time to wait for running handlers on shutdown
     */
    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /**
     * Policy used when a trigger references none or an unknown one
     */
    private String defaultRetryPolicy = "default";

    @Valid
    private Map<String, RetryPolicyProperties> retryPolicies = new LinkedHashMap<>();

    @Data
    public static class RetryPolicyProperties {

        @NotNull
        private BackoffType backoff = BackoffType.EXPONENTIAL_JITTER;

        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration initialDelay = Duration.ofSeconds(60);

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        @NotNull
        private Duration maxDelay = Duration.ofHours(1);
    }
}
