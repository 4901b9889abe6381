package com.example.jobscheduler.lock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local lock store with TTL expiry.
 * <p>
 * Gives the same acquire/release semantics as Redis within one JVM. Several scheduler instances
 * sharing one of these behave like several processes sharing one Redis.
 */
public class InMemoryLockStoreClient implements LockStoreClient {

    private final Clock clock;
    private final Map<String, Entry> entries = new HashMap<>();

    public InMemoryLockStoreClient(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized boolean setIfAbsent(String key, String token, Duration ttl) {
        var now = clock.instant();
        var existing = entries.get(key);
        if (existing != null && existing.isLive(now)) {
            return false;
        }
        entries.put(key, new Entry(token, now.plus(ttl)));
        return true;
    }

    @Override
    public synchronized boolean compareAndDelete(String key, String token) {
        var existing = entries.get(key);
        if (existing == null || !existing.isLive(clock.instant()) || !existing.token.equals(token)) {
            return false;
        }
        entries.remove(key);
        return true;
    }

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public String getStoreName() {
        return "memory";
    }

    /**
     * Token currently stored under the key, if it has not expired
     */
    public synchronized Optional<String> currentToken(String key) {
        var existing = entries.get(key);
        if (existing == null || !existing.isLive(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(existing.token);
    }

    private static final class Entry {
        private final String token;
        private final Instant expiresAt;

        private Entry(String token, Instant expiresAt) {
            this.token = token;
            this.expiresAt = expiresAt;
        }

        private boolean isLive(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
