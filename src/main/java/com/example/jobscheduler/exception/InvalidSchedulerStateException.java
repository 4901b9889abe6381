package com.example.jobscheduler.exception;

import com.example.jobscheduler.domain.enums.SchedulerState;
import lombok.Getter;

/**
 * Exception for an operation the scheduler cannot perform in its current lifecycle state
 */
@Getter
public class InvalidSchedulerStateException extends RuntimeException {

    private final SchedulerState currentState;
    private final String operation;

    public InvalidSchedulerStateException(SchedulerState currentState, String operation) {
        super(String.format("Cannot %s scheduler in state %s", operation, currentState));
        this.currentState = currentState;
        this.operation = operation;
    }
}
