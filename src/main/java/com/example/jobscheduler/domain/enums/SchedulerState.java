package com.example.jobscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle states of the scheduler core.
 * <p>
 * Transitions only move forward: UNINITIALIZED → INITIALIZED → RUNNING → STOPPED.
 * A stopped scheduler cannot be restarted; a fresh instance must be constructed.
 */
@Getter
@RequiredArgsConstructor
public enum SchedulerState {

    /**
     * Constructed, defaults and listeners not yet installed.
     */
    UNINITIALIZED("uninitialized", false),

    /**
     * Defaults validated and listeners installed. Jobs may be registered but nothing fires.
     */
    INITIALIZED("initialized", true),

    /**
     * Fire loop active.
     */
    RUNNING("running", true),

    /**
     * Terminal state.
     */
    STOPPED("stopped", false);

    private final String code;

    /**
     * Whether jobs may be added, removed, paused or resumed in this state
     */
    private final boolean acceptingJobs;

    public boolean isTerminal() {
        return this == STOPPED;
    }
}
