package com.example.jobscheduler.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Proof of one successful lock acquisition. Lives only for the duration of a single
 * invocation attempt and is the only thing that can release the lock it represents.
 */
@Value
public class LockHandle {

    String lockKey;

    String token;

    Instant acquiredAt;

    long ttlSeconds;

    /**
     * Token prefix safe to put in logs
     */
    public String shortToken() {
        return token.length() > 8 ? token.substring(0, 8) : token;
    }

    public Instant expiresAt() {
        return acquiredAt.plusSeconds(ttlSeconds);
    }
}
