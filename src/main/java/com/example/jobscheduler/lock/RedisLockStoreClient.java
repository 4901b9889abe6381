package com.example.jobscheduler.lock;

import com.example.jobscheduler.exception.LockReleaseException;
import com.example.jobscheduler.exception.LockUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.List;

/**
 * Redis-backed lock store.
 * <p>
 * Acquisition is a single {@code SET key token NX EX ttl}. Release runs a Lua script that deletes the key
 * only while it still holds the caller's token. {@link StringRedisTemplate#execute} sends the script by
 * SHA and falls back to a full EVAL when the server has no cached copy, so a restarted Redis does not
 * break atomicity.
 */
@Slf4j
public class RedisLockStoreClient implements LockStoreClient {

    static final String RELEASE_LOCK_SCRIPT = "if redis.call('GET', KEYS[1]) == ARGV[1] then "
            + "return redis.call('DEL', KEYS[1]); "
            + "else return 0; end;";

    private final StringRedisTemplate stringRedisTemplate;
    private final DefaultRedisScript<Long> releaseScript;
    private final boolean nonAtomicReleaseFallback;

    public RedisLockStoreClient(StringRedisTemplate stringRedisTemplate, boolean nonAtomicReleaseFallback) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.releaseScript = new DefaultRedisScript<>(RELEASE_LOCK_SCRIPT, Long.class);
        this.nonAtomicReleaseFallback = nonAtomicReleaseFallback;
    }

    @Override
    public boolean setIfAbsent(String key, String token, Duration ttl) {
        try {
            return Boolean.TRUE.equals(stringRedisTemplate.opsForValue().setIfAbsent(key, token, ttl));
        } catch (DataAccessException e) {
            throw new LockUnavailableException(key, e);
        }
    }

    @Override
    public boolean compareAndDelete(String key, String token) {
        try {
            var deleted = stringRedisTemplate.execute(releaseScript, List.of(key), token);
            return deleted != null && deleted == 1L;
        } catch (DataAccessException e) {
            if (!nonAtomicReleaseFallback) {
                throw new LockReleaseException(key, e);
            }
            log.warn("Release script failed for {}, falling back to non-atomic GET/DEL (lock may be taken over between the two): {}",
                    key, e.getMessage());
            return compareAndDeleteNonAtomic(key, token);
        }
    }

    private boolean compareAndDeleteNonAtomic(String key, String token) {
        try {
            var current = stringRedisTemplate.opsForValue().get(key);
            if (!token.equals(current)) {
                return false;
            }
            return Boolean.TRUE.equals(stringRedisTemplate.delete(key));
        } catch (DataAccessException e) {
            throw new LockReleaseException(key, e);
        }
    }

    @Override
    public boolean ping() {
        try {
            var pong = stringRedisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            return "PONG".equalsIgnoreCase(pong);
        } catch (DataAccessException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getStoreName() {
        return "redis";
    }
}
