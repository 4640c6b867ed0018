package com.example.taskorchestrator.service.executor;

import com.example.taskorchestrator.config.OrchestratorProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;

/**
 * Fixed number of concurrently running jobs on this worker.
 */
@Component
public class ExecutionSlotPool {

    private final int capacity;
    private final Semaphore slots;

    @Autowired
    public ExecutionSlotPool(OrchestratorProperties properties) {
        this(properties.getExecutionSlots());
    }

    ExecutionSlotPool(int capacity) {
        this.capacity = capacity;
        this.slots = new Semaphore(capacity);
    }

    public boolean tryAcquire() {
        return slots.tryAcquire();
    }

    public void release() {
        slots.release();
    }

    public int available() {
        return slots.availablePermits();
    }

    public int inUse() {
        return capacity - slots.availablePermits();
    }
}
