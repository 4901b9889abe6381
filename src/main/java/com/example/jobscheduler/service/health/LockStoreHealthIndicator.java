package com.example.jobscheduler.service.health;

import com.example.jobscheduler.lock.LockStoreClient;
import com.example.jobscheduler.service.scheduler.SchedulerCore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the scheduler as down when the lock store does not answer a ping.
 * While the store is unreachable every distributed job run is skipped.
 */
@Slf4j
@Component("jobScheduler")
@RequiredArgsConstructor
public class LockStoreHealthIndicator implements HealthIndicator {

    private final LockStoreClient lockStoreClient;
    private final SchedulerCore schedulerCore;

    @Override
    public Health health() {
        var builder = lockStoreReachable() ? Health.up() : Health.down();
        return builder
                .withDetail("lockStore", lockStoreClient.getStoreName())
                .withDetail("schedulerState", schedulerCore.getState().getCode())
                .withDetail("instanceId", schedulerCore.getInstanceId())
                .withDetail("jobs", schedulerCore.listJobs().size())
                .build();
    }

    private boolean lockStoreReachable() {
        try {
            return lockStoreClient.ping();
        } catch (RuntimeException e) {
            log.warn("Lock store health check failed: {}", e.getMessage());
            return false;
        }
    }
}
