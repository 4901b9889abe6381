package com.example.jobscheduler.trigger;

import java.time.Duration;
import java.time.Instant;

/**
 * Fires every {@code interval}, optionally anchored on a start time.
 */
public class IntervalTrigger implements JobTrigger {

    private final Duration interval;
    private final Instant startTime;

    public IntervalTrigger(Duration interval, Instant startTime) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + interval);
        }
        this.interval = interval;
        this.startTime = startTime;
    }

    @Override
    public Instant nextFireTime(Instant previousFireTime, Instant now) {
        if (previousFireTime != null) {
            return previousFireTime.plus(interval);
        }
        if (startTime == null) {
            return now.plus(interval);
        }
        if (!startTime.isBefore(now)) {
            return startTime;
        }

        // first grid point start + k * interval that is not before now
        var elapsedNanos = Duration.between(startTime, now).toNanos();
        var intervalNanos = interval.toNanos();
        var periods = (elapsedNanos + intervalNanos - 1) / intervalNanos;
        return startTime.plus(interval.multipliedBy(periods));
    }

    public Duration getInterval() {
        return interval;
    }

    @Override
    public String describe() {
        return startTime != null
                ? String.format("interval[%s, start=%s]", interval, startTime)
                : String.format("interval[%s]", interval);
    }
}
