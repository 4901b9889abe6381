package com.example.jobscheduler.domain.model;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable per-job scheduling state.
 * <p>
 * {@code nextFireTime} and {@code paused} are written only under the scheduler's loop lock.
 * The running-instance counter is updated by worker threads, so slots are reserved with a CAS
 * loop that never lets the count exceed the job's {@code maxInstances}.
 */
public class ScheduleState {

    private volatile Instant nextFireTime;
    private volatile boolean paused;
    private final AtomicInteger runningInstances = new AtomicInteger();

    public ScheduleState(Instant nextFireTime) {
        this.nextFireTime = nextFireTime;
    }

    public Instant getNextFireTime() {
        return nextFireTime;
    }

    public void setNextFireTime(Instant nextFireTime) {
        this.nextFireTime = nextFireTime;
    }

    public boolean isPaused() {
        return paused;
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    public int getRunningInstances() {
        return runningInstances.get();
    }

    /**
     * Claim one execution slot.
     *
     * @return false if the job is already at capacity
     */
    public boolean tryReserveInstance(int maxInstances) {
        while (true) {
            var current = runningInstances.get();
            if (current >= maxInstances) {
                return false;
            }
            if (runningInstances.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void releaseInstance() {
        runningInstances.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }
}
