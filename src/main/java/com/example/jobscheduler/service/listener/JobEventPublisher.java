package com.example.jobscheduler.service.listener;

import com.example.jobscheduler.domain.model.JobEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans job events out to the installed listeners. A failing listener is logged and
 * never affects the other listeners or the caller, whether it throws an exception or an error.
 * Only virtual machine errors propagate.
 */
@Slf4j
public class JobEventPublisher {

    private final List<JobExecutionListener> listeners = new CopyOnWriteArrayList<>();

    public void install(Collection<? extends JobExecutionListener> toInstall) {
        listeners.addAll(toInstall);
    }

    public void install(JobExecutionListener listener) {
        listeners.add(listener);
    }

    public int getListenerCount() {
        return listeners.size();
    }

    /**
     * Deliver an event to every listener, in installation order
     */
    public void publish(JobEvent event) {
        for (var listener : listeners) {
            try {
                switch (event.getOutcome()) {
                    case SUCCESS -> listener.onExecuted(event);
                    case ERROR -> listener.onError(event, event.getError());
                    default -> listener.onSkipped(event);
                }
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                log.error("Job listener {} failed on {} event for job {}: {}",
                        listener.getClass().getSimpleName(), event.getOutcome(), event.getJobId(), e.getMessage(), e);
            }
        }
    }
}
