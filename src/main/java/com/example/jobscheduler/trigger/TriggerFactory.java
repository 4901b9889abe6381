package com.example.jobscheduler.trigger;

import com.example.jobscheduler.domain.model.CronSpec;
import com.example.jobscheduler.domain.model.IntervalSpec;
import com.example.jobscheduler.domain.model.TriggerSpec;
import com.example.jobscheduler.exception.SchedulerConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Locale;

/**
 * Turns trigger specs into triggers and rejects specs that can never fire.
 * <p>
 * All validation happens here, at registration time, so a bad schedule never reaches the fire loop.
 */
@Slf4j
@Component
public class TriggerFactory {

    /**
     * A schedule with no fire time inside this window is treated as unsatisfiable
     */
    static final Duration HORIZON = Duration.ofDays(366);

    /**
     * Build and validate the trigger for a job
     *
     * @throws SchedulerConfigurationException if the spec is invalid or never fires
     */
    public JobTrigger create(String jobId, TriggerSpec spec, Instant now) {
        if (spec instanceof IntervalSpec intervalSpec) {
            return createIntervalTrigger(jobId, intervalSpec, now);
        }
        if (spec instanceof CronSpec cronSpec) {
            return createCronTrigger(jobId, cronSpec, now);
        }
        throw new SchedulerConfigurationException(jobId,
                "unsupported trigger spec " + (spec == null ? "null" : spec.getClass().getSimpleName()));
    }

    private JobTrigger createIntervalTrigger(String jobId, IntervalSpec spec, Instant now) {
        if (spec.getHours() < 0 || spec.getMinutes() < 0 || spec.getSeconds() < 0) {
            throw new SchedulerConfigurationException(jobId, "interval fields must not be negative: " + spec.describe());
        }
        Duration interval;
        try {
            interval = spec.toDuration();
        } catch (ArithmeticException e) {
            throw new SchedulerConfigurationException(jobId, "interval out of range: " + spec.describe(), e);
        }
        if (interval.isZero()) {
            throw new SchedulerConfigurationException(jobId, "interval must be positive: " + spec.describe());
        }

        var trigger = new IntervalTrigger(interval, spec.getStartTime());
        try {
            trigger.nextFireTime(null, now);
        } catch (ArithmeticException | DateTimeException e) {
            throw new SchedulerConfigurationException(jobId, "interval has no representable first fire time: " + spec.describe(), e);
        }
        return trigger;
    }

    private JobTrigger createCronTrigger(String jobId, CronSpec spec, Instant now) {
        CronExpression expression;
        try {
            expression = CronExpression.parse(toCronExpression(spec));
        } catch (IllegalArgumentException e) {
            throw new SchedulerConfigurationException(jobId, "invalid cron fields " + spec.describe() + ": " + e.getMessage(), e);
        }

        var trigger = new CronTrigger(expression, spec.describe());
        var first = trigger.nextFireTime(null, now);
        if (first == null || first.isAfter(now.plus(HORIZON))) {
            throw new SchedulerConfigurationException(jobId, "cron " + spec.describe() + " has no fire time within " + HORIZON.toDays() + " days");
        }
        log.debug("Cron job {} resolved to '{}', first fire at {}", jobId, expression, first);
        return trigger;
    }

    /**
     * Render the spec as a six-field Spring cron expression (second minute hour day month weekday).
     * Unset fields above the least significant given one match everything; unset fields below it are 0.
     */
    static String toCronExpression(CronSpec spec) {
        var significance = new ArrayList<String>();
        significance.add(spec.getDayOfWeek());
        significance.add(spec.getHour());
        significance.add(spec.getMinute());
        significance.add(spec.getSecond());

        var leastSignificantGiven = -1;
        for (var i = 0; i < significance.size(); i++) {
            if (isSet(significance.get(i))) {
                leastSignificantGiven = i;
            }
        }

        var resolved = new String[significance.size()];
        for (var i = 0; i < significance.size(); i++) {
            var value = significance.get(i);
            if (isSet(value)) {
                resolved[i] = value.trim();
            } else if (i > 0 && leastSignificantGiven >= 0 && i > leastSignificantGiven) {
                resolved[i] = "0";
            } else {
                resolved[i] = "*";
            }
        }

        var dayOfWeek = "*".equals(resolved[0]) ? "*" : translateDayOfWeek(resolved[0]);
        return String.join(" ", resolved[3], resolved[2], resolved[1], "*", "*", dayOfWeek);
    }

    /**
     * Map weekday numbers from 0 = Monday .. 6 = Sunday to cron's 1 = Monday .. 7 = Sunday.
     * Names pass through unchanged; steps after '/' are left alone.
     */
    static String translateDayOfWeek(String expression) {
        var parts = expression.toUpperCase(Locale.ROOT).split(",");
        var translated = new ArrayList<String>();
        for (var part : parts) {
            var stepSplit = part.trim().split("/", 2);
            var range = stepSplit[0];
            var step = stepSplit.length > 1 ? "/" + stepSplit[1] : "";
            if ("*".equals(range)) {
                translated.add(range + step);
                continue;
            }
            var bounds = range.split("-", -1);
            for (var i = 0; i < bounds.length; i++) {
                bounds[i] = shiftWeekday(bounds[i].trim());
            }
            translated.add(String.join("-", bounds) + step);
        }
        return String.join(",", translated);
    }

    private static String shiftWeekday(String token) {
        if (token.isEmpty() || !token.chars().allMatch(Character::isDigit)) {
            return token;
        }
        var day = Integer.parseInt(token);
        if (day > 6) {
            throw new IllegalArgumentException("day_of_week value out of range 0-6: " + day);
        }
        return String.valueOf(day + 1);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
