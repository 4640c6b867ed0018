package com.example.taskorchestrator.service.handler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TaskHandlerRegistry Tests")
class TaskHandlerRegistryTest {

    private TaskHandlerRegistry registry;

    private final TaskHandler reportHandler = handler("report");

    private final TaskHandler cleanupHandler = handler("cleanup");

    private static TaskHandler handler(String taskType) {
        return new TaskHandler() {
            @Override
            public String getTaskType() {
                return taskType;
            }

            @Override
            public TaskExecutionResult execute(Map<String, Object> payload, Instant deadline) {
                return TaskExecutionResult.success();
            }
        };
    }

    @BeforeEach
    void setUp() {
        registry = new TaskHandlerRegistry(List.of(reportHandler, cleanupHandler));
        registry.initialize();
    }

    @Test
    @DisplayName("Should register and retrieve discovered handlers")
    void shouldRegisterAndRetrieveHandlers() {
        assertThat(registry.lookup("report")).containsSame(reportHandler);
        assertThat(registry.lookup("cleanup")).containsSame(cleanupHandler);
    }

    @Test
    @DisplayName("Should return empty for unregistered or null type")
    void shouldReturnEmptyForUnregisteredType() {
        assertThat(registry.lookup("unknown")).isEmpty();
        assertThat(registry.lookup(null)).isEmpty();
    }

    @Test
    @DisplayName("Should accept handlers registered at runtime")
    void shouldRegisterAtRuntime() {
        var sync = handler("sync");

        registry.register("sync", sync);

        assertThat(registry.lookup("sync")).containsSame(sync);
        assertThat(registry.lookup("report")).containsSame(reportHandler);
        assertThat(registry.lookup("cleanup")).containsSame(cleanupHandler);
    }

    @Test
    @DisplayName("Later registration replaces the earlier one")
    void shouldReplaceDuplicate() {
        var replacement = handler("report");

        registry.register("report", replacement);

        assertThat(registry.lookup("report")).containsSame(replacement);
        assertThat(registry.lookup("cleanup")).containsSame(cleanupHandler);
    }

    @Test
    @DisplayName("Should reject blank task types")
    void shouldRejectBlankType() {
        assertThatThrownBy(() -> registry.register(" ", reportHandler))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be blank");
    }
}
