package com.example.jobscheduler.service.handler;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Information about the invocation a {@link JobHandler} is running in.
 */
@Value
@Builder
public class JobExecutionContext {

    String jobId;

    /**
     * Fire time the invocation was scheduled for
     */
    Instant scheduledFireTime;

    /**
     * Identity of the scheduler instance running the job
     */
    String instanceId;

    /**
     * Whether the invocation holds the distributed lock
     */
    boolean lockHeld;
}
