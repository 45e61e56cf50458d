package io.remindrunr.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Step between two occurrences of a recurring one-shot definition.
 */
public enum RecurrenceInterval {
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    YEARLY("yearly");

    private final String value;

    RecurrenceInterval(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RecurrenceInterval fromValue(String value) {
        for (RecurrenceInterval interval : values()) {
            if (interval.value.equalsIgnoreCase(value)) {
                return interval;
            }
        }
        throw new InvalidScheduleException("Repeat interval must be one of: daily, weekly, monthly, yearly");
    }
}
