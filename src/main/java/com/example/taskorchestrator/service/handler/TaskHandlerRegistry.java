package com.example.taskorchestrator.service.handler;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for task handlers.
 * <p>
 * Discovers all TaskHandler beans at startup and accepts further registrations at
 * runtime. New task types need no change to the engine.
 */
@Slf4j
@Component
public class TaskHandlerRegistry {

    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();
    private final List<TaskHandler> handlerBeans;

    public TaskHandlerRegistry(List<TaskHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            register(handler.getTaskType(), handler);
        }
        if (handlers.isEmpty()) {
            log.warn("No task handlers registered, every dispatched job will fail with HANDLER_NOT_FOUND");
        }
    }

    /**
     * Register a handler for a task type, replacing any previous registration
     */
    public void register(String taskType, TaskHandler handler) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("Task type must not be blank");
        }
        Objects.requireNonNull(handler, "handler");

        var previous = handlers.put(taskType, handler);
        if (previous != null && previous != handler) {
            log.warn("Duplicate handler for task type {}: {} will override {}",
                    taskType, handler.getClass().getSimpleName(), previous.getClass().getSimpleName());
        }
        log.info("Registered handler for task type {}: {}", taskType, handler.getClass().getSimpleName());
    }

    /**
     * Look up the handler for a task type
     *
     * @param taskType The task type
     * @return Optional containing the handler if found
     */
    public Optional<TaskHandler> lookup(String taskType) {
        if (taskType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(taskType));
    }
}
