package com.example.jobscheduler.domain.model;

import com.example.jobscheduler.domain.enums.JobOutcome;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable record of one invocation attempt, handed to the registered listeners.
 */
@Value
@Builder
public class JobEvent {

    String jobId;

    JobOutcome outcome;

    /**
     * Failure or skip reason, null on success
     */
    String errorDetail;

    Instant timestamp;

    /**
     * Fire time this attempt was scheduled for
     */
    Instant scheduledFireTime;

    /**
     * Handler run time, null when the handler was not invoked
     */
    Duration duration;

    /**
     * What the handler threw, for ERROR events
     */
    @ToString.Exclude
    Throwable error;

    public static JobEvent success(String jobId, Instant scheduledFireTime, Instant now, Duration duration) {
        return JobEvent.builder()
                .jobId(jobId)
                .outcome(JobOutcome.SUCCESS)
                .scheduledFireTime(scheduledFireTime)
                .timestamp(now)
                .duration(duration)
                .build();
    }

    public static JobEvent error(String jobId, Instant scheduledFireTime, Instant now, Duration duration, Throwable error) {
        return JobEvent.builder()
                .jobId(jobId)
                .outcome(JobOutcome.ERROR)
                .errorDetail(error.getClass().getSimpleName() + ": " + error.getMessage())
                .scheduledFireTime(scheduledFireTime)
                .timestamp(now)
                .duration(duration)
                .error(error)
                .build();
    }

    public static JobEvent skipped(String jobId, JobOutcome outcome, Instant scheduledFireTime, Instant now, String reason) {
        return JobEvent.builder()
                .jobId(jobId)
                .outcome(outcome)
                .errorDetail(reason)
                .scheduledFireTime(scheduledFireTime)
                .timestamp(now)
                .build();
    }
}
