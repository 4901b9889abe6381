package com.example.jobscheduler.service.listener;

import com.example.jobscheduler.domain.enums.JobOutcome;
import com.example.jobscheduler.domain.model.JobEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class LoggingJobListener implements JobExecutionListener {

    @Override
    public void onExecuted(JobEvent event) {
        log.debug("Job executed: {} in {}ms", event.getJobId(), event.getDuration() != null ? event.getDuration().toMillis() : 0);
    }

    @Override
    public void onError(JobEvent event, Throwable error) {
        log.error("Job error: {}, exception: {}", event.getJobId(), event.getErrorDetail(), error);
    }

    @Override
    public void onSkipped(JobEvent event) {
        if (event.getOutcome() == JobOutcome.SKIPPED_LOCK_HELD) {
            log.info("Job skipped (lock not acquired): {}{}", event.getJobId(),
                    event.getErrorDetail() != null ? " - " + event.getErrorDetail() : "");
        } else {
            log.warn("Job skipped ({}): {} - {}", event.getOutcome().getCode(), event.getJobId(), event.getErrorDetail());
        }
    }
}
