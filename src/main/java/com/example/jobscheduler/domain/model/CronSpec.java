package com.example.jobscheduler.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;

/**
 * Cron-style schedule evaluated in UTC.
 * <p>
 * Each field takes a cron field expression ({@code "5"}, {@code "*&#47;15"}, {@code "0-30"}, {@code "1,2"}).
 * Unset fields that are more significant than the least significant field given match every value;
 * unset fields below it default to their minimum. {@code dayOfWeek} accepts names ({@code mon}..{@code sun})
 * or numbers where {@code 0} is Monday and {@code 6} is Sunday.
 */
@Value
@Builder
public class CronSpec implements TriggerSpec {

    String second;
    String minute;
    String hour;
    String dayOfWeek;

    /**
     * Every day at the given UTC hour and minute
     */
    public static CronSpec dailyAt(int hour, int minute) {
        return CronSpec.builder().hour(String.valueOf(hour)).minute(String.valueOf(minute)).build();
    }

    @Override
    public String describe() {
        var parts = new ArrayList<String>();
        if (dayOfWeek != null) {
            parts.add("day_of_week='" + dayOfWeek + "'");
        }
        if (hour != null) {
            parts.add("hour='" + hour + "'");
        }
        if (minute != null) {
            parts.add("minute='" + minute + "'");
        }
        if (second != null) {
            parts.add("second='" + second + "'");
        }
        return "cron[" + String.join(", ", parts) + "]";
    }
}
