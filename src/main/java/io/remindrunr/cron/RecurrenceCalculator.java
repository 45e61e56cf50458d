package io.remindrunr.cron;

import io.remindrunr.schedule.Recurrence;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Computes the next occurrence of a recurring one-shot definition.
 *
 * <p>Daily and weekly steps are fixed durations. Monthly and yearly steps are
 * calendar increments in the definition's zone; when the target month is shorter
 * the day-of-month is clamped to its last day (Jan 31 + 1 month = Feb 28 or 29,
 * Feb 29 + 1 year = Feb 28).</p>
 *
 * <p>Pure function: the caller advances {@code currentOccurrence} on the new definition.</p>
 */
@Component
public class RecurrenceCalculator {

    private static final Duration DAY = Duration.ofHours(24);
    private static final Duration WEEK = Duration.ofDays(7);

    /**
     * Returns the occurrence following {@code lastTrigger}, or empty when the rule is exhausted
     * or the computed instant falls after the rule's end date.
     *
     * @param lastTrigger the intended trigger time of the occurrence that just fired
     * @param recurrence  the rule carried by that occurrence
     * @param zone        zone for calendar arithmetic
     */
    public Optional<Instant> nextOccurrence(Instant lastTrigger, Recurrence recurrence, ZoneId zone) {
        if (recurrence.isExhausted()) {
            return Optional.empty();
        }

        Instant next = switch (recurrence.interval()) {
            case DAILY -> lastTrigger.plus(DAY);
            case WEEKLY -> lastTrigger.plus(WEEK);
            case MONTHLY -> lastTrigger.atZone(zone).plusMonths(1).toInstant();
            case YEARLY -> lastTrigger.atZone(zone).plusYears(1).toInstant();
        };

        if (recurrence.endDate() != null && next.isAfter(recurrence.endDate())) {
            return Optional.empty();
        }
        return Optional.of(next);
    }
}
