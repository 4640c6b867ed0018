package com.example.taskorchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Task Orchestration Engine
 * <p>
 * Fires cron, interval, event and manual triggers across a pool of stateless workers.
 * A trigger runs at most once at a time cluster-wide, guarded by a lease in the shared store.
 * Failed jobs are retried according to named backoff policies.
 */
@SpringBootApplication
public class TaskOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskOrchestratorApplication.class, args);
    }
}
