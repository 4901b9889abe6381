package com.example.jobscheduler.service.scheduler;

import com.example.jobscheduler.domain.model.JobDefinition;

import java.util.List;

/**
 * Supplies jobs to register when the scheduler starts.
 * <p>
 * Every JobSource bean is asked exactly once per start; together their jobs form the
 * initial job set. Jobs may still be added later through {@link SchedulerCore#addJob}.
 */
public interface JobSource {

    List<JobDefinition> getJobs();
}
