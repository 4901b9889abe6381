package com.example.jobscheduler.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-job execution policy applied by the fire loop.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionPolicy {

    /**
     * Collapse a backlog of due fire times into a single run
     */
    @Builder.Default
    boolean coalesce = true;

    /**
     * Maximum concurrent invocations of the job on this instance
     */
    @Builder.Default
    int maxInstances = 1;

    /**
     * How late a fire may start and still count as on time
     */
    @Builder.Default
    int misfireGraceSeconds = 60;

    public static ExecutionPolicy defaults() {
        return ExecutionPolicy.builder().build();
    }
}
