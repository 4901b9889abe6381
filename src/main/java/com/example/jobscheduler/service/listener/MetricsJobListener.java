package com.example.jobscheduler.service.listener;

import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.model.JobEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Records every job event in Micrometer.
 */
@Component
@RequiredArgsConstructor
public class MetricsJobListener implements JobExecutionListener {

    private final MetricsConfig metricsConfig;

    @Override
    public void onExecuted(JobEvent event) {
        metricsConfig.recordJobEvent(event);
    }

    @Override
    public void onError(JobEvent event, Throwable error) {
        metricsConfig.recordJobEvent(event);
        metricsConfig.recordJobFailure(event.getJobId(), error != null ? error.getClass().getSimpleName() : null);
    }

    @Override
    public void onSkipped(JobEvent event) {
        metricsConfig.recordJobEvent(event);
    }
}
