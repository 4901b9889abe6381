package com.example.jobscheduler.lock;

import java.time.Duration;

/**
 * Atomic primitives of the shared key-value store backing job locks.
 * <p>
 * Implementations:
 * - RedisLockStoreClient: shared Redis, for multi-instance deployments
 * - InMemoryLockStoreClient: process-local map, for single-instance runs and tests
 */
public interface LockStoreClient {

    /**
     * Store {@code token} under {@code key} with the given expiry, only if the key is absent.
     *
     * @return true if the key was set
     * @throws com.example.jobscheduler.exception.LockUnavailableException if the store cannot be reached
     */
    boolean setIfAbsent(String key, String token, Duration ttl);

    /**
     * Delete {@code key} only if its current value equals {@code token}, as one atomic step.
     *
     * @return true if the key was deleted
     * @throws com.example.jobscheduler.exception.LockReleaseException if the store rejected the operation
     */
    boolean compareAndDelete(String key, String token);

    /**
     * Connectivity check
     */
    boolean ping();

    /**
     * Backend name for logs and health details
     */
    String getStoreName();
}
