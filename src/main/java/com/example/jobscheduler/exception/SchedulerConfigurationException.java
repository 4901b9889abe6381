package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for a job definition that cannot be scheduled, such as an invalid trigger.
 * Raised at registration time; it rejects that job only.
 */
@Getter
public class SchedulerConfigurationException extends RuntimeException {

    private final String jobId;

    public SchedulerConfigurationException(String reason) {
        super("Invalid scheduler configuration: " + reason);
        this.jobId = null;
    }

    public SchedulerConfigurationException(String jobId, String reason) {
        super(String.format("Invalid configuration for job %s: %s", jobId, reason));
        this.jobId = jobId;
    }

    public SchedulerConfigurationException(String jobId, String reason, Throwable cause) {
        super(String.format("Invalid configuration for job %s: %s", jobId, reason), cause);
        this.jobId = jobId;
    }
}
