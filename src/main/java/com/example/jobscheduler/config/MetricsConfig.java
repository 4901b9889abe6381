package com.example.jobscheduler.config;

import com.example.jobscheduler.domain.enums.JobOutcome;
import com.example.jobscheduler.domain.model.JobEvent;
import com.example.jobscheduler.domain.model.ScheduleState;
import com.example.jobscheduler.registry.JobRegistry;
import com.example.jobscheduler.registry.ScheduledJob;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for monitoring scheduler health and job outcomes.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job events by job and outcome
 * - Handler execution times
 * - Handler failures by error type
 * - Registered jobs and in-flight invocations
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final JobRegistry jobRegistry;

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("scheduler_jobs_registered", jobRegistry, JobRegistry::size)
                .description("Number of registered jobs")
                .register(meterRegistry);

        Gauge.builder("scheduler_jobs_running", jobRegistry, MetricsConfig::countRunningInstances)
                .description("Number of job invocations in flight on this instance")
                .register(meterRegistry);
    }

    /**
     * Count an event and, for executed jobs, record the handler run time
     */
    public void recordJobEvent(JobEvent event) {
        meterRegistry.counter("scheduler_job_events",
                "job", event.getJobId(),
                "outcome", event.getOutcome().getCode()
        ).increment();

        if (event.getDuration() != null) {
            Timer.builder("scheduler_job_execution_time")
                    .tag("job", event.getJobId())
                    .tag("success", String.valueOf(event.getOutcome() == JobOutcome.SUCCESS))
                    .description("Job handler execution time")
                    .register(meterRegistry)
                    .record(event.getDuration());
        }
    }

    /**
     * Record handler failure
     */
    public void recordJobFailure(String jobId, String errorType) {
        meterRegistry.counter("scheduler_job_failures",
                "job", jobId,
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    private static double countRunningInstances(JobRegistry registry) {
        return registry.listAll().stream()
                .map(ScheduledJob::getState)
                .mapToInt(ScheduleState::getRunningInstances)
                .sum();
    }
}
