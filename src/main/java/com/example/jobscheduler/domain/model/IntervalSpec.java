package com.example.jobscheduler.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-interval schedule. The interval is the sum of hours, minutes and seconds.
 * <p>
 * When {@code startTime} is set the schedule is anchored on it: the first fire is the
 * start time itself when it lies in the future, otherwise the first point of the
 * {@code startTime + k * interval} grid not earlier than now.
 */
@Value
@Builder
public class IntervalSpec implements TriggerSpec {

    long seconds;
    long minutes;
    long hours;

    /**
     * Optional anchor for the first fire time
     */
    Instant startTime;

    public static IntervalSpec ofSeconds(long seconds) {
        return IntervalSpec.builder().seconds(seconds).build();
    }

    public static IntervalSpec ofMinutes(long minutes) {
        return IntervalSpec.builder().minutes(minutes).build();
    }

    public static IntervalSpec ofHours(long hours) {
        return IntervalSpec.builder().hours(hours).build();
    }

    public Duration toDuration() {
        return Duration.ofHours(hours).plusMinutes(minutes).plusSeconds(seconds);
    }

    @Override
    public String describe() {
        var text = String.format("interval[%dh %dm %ds]", hours, minutes, seconds);
        return startTime != null ? text + " from " + startTime : text;
    }
}
