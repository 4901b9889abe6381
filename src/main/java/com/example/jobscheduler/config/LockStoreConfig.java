package com.example.jobscheduler.config;

import com.example.jobscheduler.lock.InMemoryLockStoreClient;
import com.example.jobscheduler.lock.LockStoreClient;
import com.example.jobscheduler.lock.RedisLockStoreClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Lock store backing the distributed job locks.
 * <p>
 * Redis is the default and the only choice that coordinates several processes. The in-memory
 * store only guards against overlap inside one JVM and suits single-instance or local setups.
 */
@Slf4j
@Configuration
public class LockStoreConfig {

    /**
     * Redis lock store using the auto-configured connection (spring.data.redis.*)
     */
    @Bean
    @ConditionalOnProperty(prefix = "job-scheduler", name = "lock-store", havingValue = "redis", matchIfMissing = true)
    public LockStoreClient redisLockStoreClient(StringRedisTemplate redisTemplate, JobSchedulerProperties properties) {
        var fallback = properties.getLock().isNonAtomicReleaseFallback();
        if (fallback) {
            log.warn("Non-atomic lock release fallback is enabled; a lock may be deleted after another instance took it over");
        }
        return new RedisLockStoreClient(redisTemplate, fallback);
    }

    @Bean
    @ConditionalOnProperty(prefix = "job-scheduler", name = "lock-store", havingValue = "memory")
    public LockStoreClient inMemoryLockStoreClient(Clock clock) {
        log.info("Using in-memory lock store; job locks are not shared between processes");
        return new InMemoryLockStoreClient(clock);
    }
}
