package com.example.jobscheduler.trigger;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Fires on the instants matching a cron expression, evaluated in UTC.
 */
public class CronTrigger implements JobTrigger {

    private final CronExpression expression;
    private final String description;

    public CronTrigger(CronExpression expression, String description) {
        this.expression = expression;
        this.description = description;
    }

    @Override
    public Instant nextFireTime(Instant previousFireTime, Instant now) {
        var from = previousFireTime != null ? previousFireTime : now;
        var next = expression.next(from.atZone(ZoneOffset.UTC));
        return next != null ? next.toInstant() : null;
    }

    public String getExpression() {
        return expression.toString();
    }

    @Override
    public String describe() {
        return description + " (" + expression + " UTC)";
    }
}
