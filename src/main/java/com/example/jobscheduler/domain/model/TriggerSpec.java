package com.example.jobscheduler.domain.model;

/**
 * Declarative schedule of a job. Turned into a {@link com.example.jobscheduler.trigger.JobTrigger}
 * at registration time.
 */
public interface TriggerSpec {

    /**
     * Human-readable form used in logs and job listings
     */
    String describe();
}
