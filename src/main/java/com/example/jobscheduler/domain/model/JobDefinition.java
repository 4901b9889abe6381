package com.example.jobscheduler.domain.model;

import com.example.jobscheduler.service.handler.JobHandler;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable definition of a scheduled job.
 * <p>
 * Owned by the {@link com.example.jobscheduler.registry.JobRegistry}; changes are made by
 * registering a whole new definition under the same id, never by mutating one in place.
 * A null {@code executionPolicy} or {@code lockTtlSeconds} is filled from the configured defaults
 * when the job is registered.
 */
@Value
@Builder(toBuilder = true)
public class JobDefinition {

    String jobId;

    String description;

    TriggerSpec triggerSpec;

    JobHandler handler;

    ExecutionPolicy executionPolicy;

    /**
     * Guard each invocation with the shared lock store so only one instance runs it
     */
    @Builder.Default
    boolean distributed = true;

    /**
     * Lease length of the distributed lock
     */
    Integer lockTtlSeconds;
}
