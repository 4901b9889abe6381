package com.example.jobscheduler.lock;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.model.LockHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Lease-based mutex keeping a job running on at most one instance at a time.
 * <p>
 * Acquisition never waits: a lock held elsewhere means a previous run is still going and this
 * tick is skipped. Every acquisition carries a fresh random token, and release deletes the key only
 * while it still holds that token, so a holder whose lease expired cannot remove its successor's lock.
 * A lock that is never released is reclaimed by its TTL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DistributedMutex {

    private final LockStoreClient lockStore;
    private final JobSchedulerProperties properties;
    private final Clock clock;

    /**
     * Try to take the lock of a job.
     *
     * @param jobId      Job the lock belongs to
     * @param ttlSeconds Lease length
     * @return the handle, or empty if another holder is active
     * @throws com.example.jobscheduler.exception.LockUnavailableException if the lock store cannot be reached
     */
    public Optional<LockHandle> acquire(String jobId, long ttlSeconds) {
        var lockKey = lockKey(jobId);
        var token = UUID.randomUUID().toString();

        if (!lockStore.setIfAbsent(lockKey, token, Duration.ofSeconds(ttlSeconds))) {
            log.debug("Distributed lock not acquired (already held): job={}", jobId);
            return Optional.empty();
        }

        var handle = new LockHandle(lockKey, token, clock.instant(), ttlSeconds);
        log.debug("Distributed lock acquired: job={}, token={}", jobId, handle.shortToken());
        return Optional.of(handle);
    }

    /**
     * Release a lock if it is still owned by the handle. Never throws.
     *
     * @return true if the lock was deleted
     */
    public boolean release(LockHandle handle) {
        boolean released;
        try {
            released = lockStore.compareAndDelete(handle.getLockKey(), handle.getToken());
        } catch (RuntimeException e) {
            log.warn("Distributed lock release error: key={}, token={}, lock expires at {}: {}",
                    handle.getLockKey(), handle.shortToken(), handle.expiresAt(), e.getMessage());
            return false;
        }

        if (released) {
            log.debug("Distributed lock released: key={}", handle.getLockKey());
        } else {
            log.warn("Distributed lock release failed (not owner or expired): key={}, token={}",
                    handle.getLockKey(), handle.shortToken());
        }
        return released;
    }

    public String lockKey(String jobId) {
        return properties.getLockKeyPrefix() + jobId;
    }
}
