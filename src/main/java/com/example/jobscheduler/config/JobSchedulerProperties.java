package com.example.jobscheduler.config;

import com.example.jobscheduler.domain.model.ExecutionPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-scheduler")
public class JobSchedulerProperties {

    /**
     * Default lease length of a job's distributed lock, in seconds
     */
    @Min(1)
    private int lockTtlSeconds = 300;

    /**
     * Default tolerance after a due time within which a late fire still runs
     */
    @Min(0)
    private int misfireGraceSeconds = 60;

    /**
     * Default for collapsing a backlog of due fire times into one run
     */
    private boolean coalesce = true;

    /**
     * Default maximum concurrent invocations of one job on this instance
     */
    @Min(1)
    private int maxInstances = 1;

    /**
     * How long stop() waits for in-flight jobs before interrupting them
     */
    @Min(0)
    private int drainTimeoutSeconds = 60;

    /**
     * Number of worker threads running job handlers
     */
    @Min(1)
    private int executorPoolSize = 20;

    /**
     * Upper bound on how long the fire loop sleeps when no job is due
     */
    @Min(10)
    private long maxIdleWaitMs = 60000;

    /**
     * Key prefix of job locks in the shared store
     */
    @NotBlank
    private String lockKeyPrefix = "scheduler:lock:";

    /**
     * Lock store backend: "redis" for multi-instance deployments, "memory" for a single process
     */
    @NotBlank
    private String lockStore = "redis";

    /**
     * Start the scheduler together with the application context
     */
    private boolean autoStartup = true;

    /**
     * Identity reported by this instance; derived from host and pid when blank
     */
    private String instanceId;

    @Valid
    private Lock lock = new Lock();

    @Data
    public static class Lock {

        /**
         * Allow a GET/compare/DEL release when the lock store rejects the release script.
         * Not atomic: another instance may take over the key between the read and the delete.
         */
        private boolean nonAtomicReleaseFallback = false;
    }

    /**
     * Execution policy applied to jobs registered without one
     */
    public ExecutionPolicy defaultExecutionPolicy() {
        return ExecutionPolicy.builder()
                .coalesce(coalesce)
                .maxInstances(maxInstances)
                .misfireGraceSeconds(misfireGraceSeconds)
                .build();
    }
}
