package com.example.jobscheduler.service.listener;

import com.example.jobscheduler.domain.model.JobEvent;

/**
 * Observer of job invocation outcomes.
 * <p>
 * Called synchronously on the worker thread right after each attempt. Implementations should return
 * quickly; anything they throw is logged and discarded.
 */
public interface JobExecutionListener {

    /**
     * The handler ran and completed normally
     */
    void onExecuted(JobEvent event);

    /**
     * The handler ran and threw
     *
     * @param event Event with outcome ERROR
     * @param error What the handler threw
     */
    void onError(JobEvent event, Throwable error);

    /**
     * The attempt was skipped: lock held elsewhere, capacity reached or fire time missed
     */
    default void onSkipped(JobEvent event) {
    }
}
