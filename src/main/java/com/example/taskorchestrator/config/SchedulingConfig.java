package com.example.taskorchestrator.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Background loops run only when {@code task-orchestrator.scheduling-enabled} is true,
 * which lets tests drive the engine step by step.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "task-orchestrator", name = "scheduling-enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
