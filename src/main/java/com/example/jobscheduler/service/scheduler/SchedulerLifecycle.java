package com.example.jobscheduler.service.scheduler;

import com.example.jobscheduler.config.JobSchedulerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Ties the scheduler to the application context: started once every bean is ready, stopped
 * (and drained) before the context closes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulerLifecycle implements SmartLifecycle {

    private final SchedulerCore schedulerCore;
    private final JobSchedulerProperties properties;

    @Override
    public void start() {
        schedulerCore.start();
    }

    @Override
    public void stop() {
        log.info("Application context closing, stopping scheduler");
        schedulerCore.stop();
    }

    @Override
    public boolean isRunning() {
        return schedulerCore.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStartup();
    }

    /**
     * Start last and stop first, so job handlers can still reach the beans they use while draining
     */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1000;
    }
}
