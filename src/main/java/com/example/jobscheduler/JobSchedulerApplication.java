package com.example.jobscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Distributed Job Scheduler Application
 * <p>
 * Runs recurring jobs on interval and cron schedules inside every service instance, with a
 * Redis-backed lock so each fire time executes on at most one instance.
 * <p>
 * Features:
 * - Interval and cron triggers with misfire grace and coalescing
 * - Per-job max concurrent instances
 * - Token-owned Redis locks released with an atomic compare-and-delete
 * - Graceful drain of running jobs on shutdown
 * - Logging, Prometheus metrics and Slack alerts for job outcomes
 */
@SpringBootApplication
public class JobSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobSchedulerApplication.class, args);
    }
}
