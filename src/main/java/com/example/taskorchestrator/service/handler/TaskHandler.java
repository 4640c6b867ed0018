package com.example.taskorchestrator.service.handler;

import java.time.Instant;
import java.util.Map;

/**
 * Interface for task handlers.
 * <p>
 * A handler is the task-type specific unit of work the engine dispatches to. The engine
 * knows nothing about what a handler does; it looks one up by {@link #getTaskType()} and
 * hands it the trigger's parameter payload.
 * <p>
 * Handlers should:
 * - Be stateless and idempotent, a job may run again after a crash
 * - Respond to thread interruption, which is how the engine cancels them
 * - Report expected failures as results and throw only for unexpected ones
 */
public interface TaskHandler {

    /**
     * Get the task type this handler executes
     */
    String getTaskType();

    /**
     * Execute the task
     *
     * @param payload  The trigger's parameter payload
     * @param deadline Instant after which the engine cancels the call
     * @return Result of the execution
     * @throws Exception on unexpected failure. {@link com.example.taskorchestrator.exception.TaskExecutionException}
     *                   with {@code retryable = false} marks the failure fatal
     */
    TaskExecutionResult execute(Map<String, Object> payload, Instant deadline) throws Exception;
}
