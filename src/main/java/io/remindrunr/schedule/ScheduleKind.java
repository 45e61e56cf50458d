package io.remindrunr.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two shapes a schedule definition can take.
 */
public enum ScheduleKind {

    /** Fires once at a fixed instant; may spawn a follow-up definition via recurrence. */
    ONE_SHOT("one-shot"),

    /** Fires on one or more cron expressions for as long as it is enabled. */
    CRON_RECURRING("cron-recurring");

    private final String value;

    ScheduleKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ScheduleKind fromValue(String value) {
        for (ScheduleKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new InvalidScheduleException("Kind must be one of: one-shot, cron-recurring");
    }
}
