package com.example.jobscheduler.registry;

import com.example.jobscheduler.domain.model.JobDefinition;
import com.example.jobscheduler.domain.model.ScheduleState;
import com.example.jobscheduler.trigger.JobTrigger;
import lombok.Value;

/**
 * Registry entry: a resolved job definition, its trigger and its scheduling state.
 */
@Value
public class ScheduledJob {

    JobDefinition definition;

    JobTrigger trigger;

    ScheduleState state;

    public String getJobId() {
        return definition.getJobId();
    }
}
