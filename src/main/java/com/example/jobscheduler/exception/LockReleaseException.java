package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for a failed compare-and-delete of a job lock.
 * The lock is left to expire through its TTL.
 */
@Getter
public class LockReleaseException extends RuntimeException {

    private final String lockKey;

    public LockReleaseException(String lockKey, Throwable cause) {
        super(String.format("Failed to release lock %s: %s", lockKey, cause.getMessage()), cause);
        this.lockKey = lockKey;
    }
}
