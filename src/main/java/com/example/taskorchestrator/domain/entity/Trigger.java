package com.example.taskorchestrator.domain.entity;

import com.example.taskorchestrator.domain.enums.IntervalUnit;
import com.example.taskorchestrator.domain.enums.ScheduleType;
import com.example.taskorchestrator.domain.enums.TriggerPriority;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A persisted scheduling intent: when to fire and what to run.
 * <p>
 * Definitions are owned by the trigger CRUD layer. The engine only ever writes the
 * schedule state ({@code nextDueAt}, {@code lastExecutedAt}) and the execution
 * outcome summary, always through targeted update queries so concurrent edits to the
 * definition are never overwritten.
 */
@Entity
@Table(name = "scheduled_triggers", indexes = {
        @Index(name = "idx_trigger_active_next_due", columnList = "active, next_due_at"),
        @Index(name = "idx_trigger_owner", columnList = "owner_id"),
        @Index(name = "idx_trigger_task_type", columnList = "task_type")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Trigger {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Opaque owner reference, used for scoping only
     */
    @Column(name = "owner_id", length = 100)
    private String ownerId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    // === Schedule ===

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_type", nullable = false, length = 20)
    private ScheduleType scheduleType;

    /**
     * 5-field (minute precision) or 6-field (with seconds) cron expression
     */
    @Column(name = "cron_expression", length = 100)
    private String cronExpression;

    @Column(name = "timezone", length = 50)
    @Builder.Default
    private String timezone = "UTC";

    @Column(name = "interval_amount")
    private Long intervalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "interval_unit", length = 20)
    private IntervalUnit intervalUnit;

    // === Execution ===

    /**
     * Dispatch key into the handler registry
     */
    @Column(name = "task_type", nullable = false, length = 100)
    private String taskType;

    /**
     * Handler parameters, opaque to the engine
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "parameters")
    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    @Column(name = "max_execution_seconds")
    private Long maxExecutionSeconds;

    /**
     * Name of a configured retry policy
     */
    @Column(name = "retry_policy", length = 100)
    private String retryPolicy;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 20)
    @Builder.Default
    private TriggerPriority priority = TriggerPriority.NORMAL;

    // === Schedule State ===

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;

    /**
     * Null for event and manual triggers, or once a cron expression has no further fire time
     */
    @Column(name = "next_due_at")
    private Instant nextDueAt;

    @Column(name = "last_executed_at")
    private Instant lastExecutedAt;

    @Column(name = "last_outcome", length = 30)
    private String lastOutcome;

    // === Execution Statistics ===

    @Column(name = "total_executions", nullable = false)
    @Builder.Default
    private Long totalExecutions = 0L;

    @Column(name = "successful_executions", nullable = false)
    @Builder.Default
    private Long successfulExecutions = 0L;

    @Column(name = "failed_executions", nullable = false)
    @Builder.Default
    private Long failedExecutions = 0L;

    @Column(name = "average_execution_ms", nullable = false)
    @Builder.Default
    private Double averageExecutionMs = 0.0;

    @Version
    @Column(name = "version")
    private Long version;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.priority == null) {
            this.priority = TriggerPriority.NORMAL;
        }
        if (this.timezone == null) {
            this.timezone = "UTC";
        }
        if (this.parameters == null) {
            this.parameters = new HashMap<>();
        }
        if (this.totalExecutions == null) {
            this.totalExecutions = 0L;
        }
        if (this.successfulExecutions == null) {
            this.successfulExecutions = 0L;
        }
        if (this.failedExecutions == null) {
            this.failedExecutions = 0L;
        }
        if (this.averageExecutionMs == null) {
            this.averageExecutionMs = 0.0;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    /**
     * Max execution duration, falling back to the engine default when unset
     */
    public Duration getEffectiveMaxExecution(Duration defaultMaxExecution) {
        return maxExecutionSeconds != null && maxExecutionSeconds > 0
                ? Duration.ofSeconds(maxExecutionSeconds)
                : defaultMaxExecution;
    }

    /**
     * Check if the trigger is due at the given instant
     */
    public boolean isDue(Instant now) {
        return active && nextDueAt != null && !nextDueAt.isAfter(now);
    }
}
