package com.example.jobscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of a single invocation attempt of a scheduled job.
 */
@Getter
@RequiredArgsConstructor
public enum JobOutcome {

    /**
     * Handler ran and returned normally.
     */
    SUCCESS("success", true),

    /**
     * Handler ran and threw.
     */
    ERROR("error", true),

    /**
     * Another holder owns the distributed lock (or the lock store was unreachable), so this tick was skipped.
     */
    SKIPPED_LOCK_HELD("skipped-lock-held", false),

    /**
     * The job already had {@code maxInstances} invocations in flight on this instance.
     */
    SKIPPED_MAX_INSTANCES("skipped-max-instances", false),

    /**
     * The fire time fell outside the misfire grace window and was dropped.
     */
    MISSED("missed", false);

    private final String code;

    /**
     * Whether the handler was actually invoked
     */
    private final boolean executed;

    public boolean isSkipped() {
        return !executed;
    }

    public static JobOutcome fromCode(String code) {
        for (var outcome : values()) {
            if (outcome.getCode().equals(code)) {
                return outcome;
            }
        }
        throw new IllegalArgumentException("Unknown job outcome code: " + code);
    }
}
