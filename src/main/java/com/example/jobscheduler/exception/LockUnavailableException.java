package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for a lock store that could not be reached while acquiring a job lock
 */
@Getter
public class LockUnavailableException extends RuntimeException {

    private final String lockKey;

    public LockUnavailableException(String lockKey, Throwable cause) {
        super(String.format("Lock store unavailable while acquiring %s: %s", lockKey, cause.getMessage()), cause);
        this.lockKey = lockKey;
    }
}
