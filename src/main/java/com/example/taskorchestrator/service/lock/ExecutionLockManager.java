package com.example.taskorchestrator.service.lock;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL-based mutual exclusion per resource id across worker processes.
 * <p>
 * There is no queuing or fairness: an empty result from {@link #acquire} means
 * "try again later". Implementations throw
 * {@link com.example.taskorchestrator.exception.StoreUnavailableException} when the
 * backing store cannot be reached.
 */
public interface ExecutionLockManager {

    /**
     * Atomically create a lock unless an unexpired one exists for the resource.
     *
     * @return the lock, or empty when denied
     */
    Optional<ExecutionLock> acquire(String resourceId, String holderId, Duration ttl);

    /**
     * Extend a lock the caller still holds.
     *
     * @return the extended lock, or empty when the lock was lost
     */
    Optional<ExecutionLock> heartbeat(ExecutionLock lock, Duration ttl);

    /**
     * Delete the lock. Idempotent, a no-op if it already expired or was taken over.
     */
    void release(ExecutionLock lock);

    /**
     * The unexpired lock for a resource, if any
     */
    Optional<ExecutionLock> findLive(String resourceId);

    /**
     * Delete expired lock rows.
     *
     * @return number of rows removed
     */
    int purgeExpired();
}
