package com.example.jobscheduler.trigger;

import java.time.Instant;

/**
 * Computes the fire times of a job.
 * <p>
 * Implementations are stateless and deterministic: the same inputs always produce the same result,
 * and a result is always strictly later than the previous fire time it was computed from.
 */
public interface JobTrigger {

    /**
     * Next fire time of the job.
     *
     * @param previousFireTime Last fire time, or null when the job has not fired yet
     * @param now              Current time; only consulted when {@code previousFireTime} is null
     * @return the next fire time, or null if the trigger will never fire again
     */
    Instant nextFireTime(Instant previousFireTime, Instant now);

    String describe();
}
