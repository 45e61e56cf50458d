package io.remindrunr.schedule;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Recurrence rule attached to a one-shot definition.
 *
 * @param interval          step between occurrences
 * @param endDate           no occurrence is created after this instant (null for open-ended)
 * @param maxOccurrences    total number of occurrences including the first (null for unlimited)
 * @param currentOccurrence 1-based index of the occurrence this definition represents
 */
public record Recurrence(
        RecurrenceInterval interval,
        Instant endDate,
        Integer maxOccurrences,
        int currentOccurrence
) {
    public Recurrence {
        if (interval == null) {
            throw new InvalidScheduleException("Repeat interval is required");
        }
        if (maxOccurrences != null && maxOccurrences < 1) {
            throw new InvalidScheduleException("maxOccurrences must be at least 1");
        }
        if (currentOccurrence < 1) {
            currentOccurrence = 1;
        }
    }

    /**
     * Creates a rule for the first occurrence.
     */
    public static Recurrence of(RecurrenceInterval interval, Instant endDate, Integer maxOccurrences) {
        return new Recurrence(interval, endDate, maxOccurrences, 1);
    }

    /**
     * Returns true once no further occurrence may be created.
     */
    @JsonIgnore
    public boolean isExhausted() {
        return maxOccurrences != null && currentOccurrence >= maxOccurrences;
    }

    /**
     * Returns the rule carried by the follow-up definition.
     */
    public Recurrence advance() {
        return new Recurrence(interval, endDate, maxOccurrences, currentOccurrence + 1);
    }
}
