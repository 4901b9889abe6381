package com.example.jobscheduler.service.scheduler;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.enums.JobOutcome;
import com.example.jobscheduler.domain.model.JobDefinition;
import com.example.jobscheduler.domain.model.JobEvent;
import com.example.jobscheduler.domain.model.LockHandle;
import com.example.jobscheduler.exception.LockUnavailableException;
import com.example.jobscheduler.lock.DistributedMutex;
import com.example.jobscheduler.service.handler.JobExecutionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Runs one invocation attempt of a job.
 * <p>
 * For distributed jobs the sequence is fixed: acquire the lock, run the handler, release the lock.
 * Release always happens once the lock was acquired, whether the handler succeeded, threw or was
 * interrupted. Failures never escape; they come back as the outcome of the returned event.
 */
@Slf4j
@Component
public class JobInvoker {

    private final DistributedMutex mutex;
    private final Clock clock;
    private final String instanceId;

    public JobInvoker(DistributedMutex mutex, JobSchedulerProperties properties, Clock clock) {
        this.mutex = mutex;
        this.clock = clock;
        this.instanceId = resolveInstanceId(properties.getInstanceId());
    }

    /**
     * Invoke a job once
     *
     * @param definition        Resolved job definition
     * @param scheduledFireTime Fire time this attempt belongs to
     * @return what happened
     */
    public JobEvent invoke(JobDefinition definition, Instant scheduledFireTime) {
        if (!definition.isDistributed()) {
            return runHandler(definition, scheduledFireTime, false);
        }

        var jobId = definition.getJobId();
        LockHandle handle;
        try {
            handle = mutex.acquire(jobId, definition.getLockTtlSeconds()).orElse(null);
        } catch (LockUnavailableException e) {
            log.warn("Lock store unavailable for job {}, skipping this run: {}", jobId, e.getMessage());
            return JobEvent.skipped(jobId, JobOutcome.SKIPPED_LOCK_HELD, scheduledFireTime, clock.instant(), e.getMessage());
        }

        if (handle == null) {
            return JobEvent.skipped(jobId, JobOutcome.SKIPPED_LOCK_HELD, scheduledFireTime, clock.instant(),
                    "lock held by another instance");
        }

        try {
            return runHandler(definition, scheduledFireTime, true);
        } finally {
            releaseClearingInterrupt(handle);
        }
    }

    private JobEvent runHandler(JobDefinition definition, Instant scheduledFireTime, boolean lockHeld) {
        var jobId = definition.getJobId();
        var context = JobExecutionContext.builder()
                .jobId(jobId)
                .scheduledFireTime(scheduledFireTime)
                .instanceId(instanceId)
                .lockHeld(lockHeld)
                .build();

        var startTime = clock.instant();
        try {
            definition.getHandler().execute(context);
            var endTime = clock.instant();
            return JobEvent.success(jobId, scheduledFireTime, endTime, Duration.between(startTime, endTime));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            var endTime = clock.instant();
            return JobEvent.error(jobId, scheduledFireTime, endTime, Duration.between(startTime, endTime), e);
        } catch (Exception e) {
            var endTime = clock.instant();
            return JobEvent.error(jobId, scheduledFireTime, endTime, Duration.between(startTime, endTime), e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Error e) {
            // AssertionError, linkage and initializer errors belong to this job only
            var endTime = clock.instant();
            return JobEvent.error(jobId, scheduledFireTime, endTime, Duration.between(startTime, endTime), e);
        }
    }

    /**
     * The release call goes over the network; an interrupted thread would abort it, so the flag is
     * cleared for the call and restored afterwards.
     */
    private void releaseClearingInterrupt(LockHandle handle) {
        var interrupted = Thread.interrupted();
        try {
            mutex.release(handle);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public String getInstanceId() {
        return instanceId;
    }

    private static String resolveInstanceId(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + ProcessHandle.current().pid();
        } catch (Exception e) {
            return "scheduler-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }
}
