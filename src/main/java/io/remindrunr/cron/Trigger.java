package io.remindrunr.cron;

import io.remindrunr.schedule.InvalidScheduleException;
import io.remindrunr.schedule.TriggerSpec;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Temporal condition controlling when a definition fires.
 */
public interface Trigger {

    /**
     * Returns the next instant strictly after {@code from} at which this trigger fires,
     * or empty if it will not fire again.
     */
    Optional<Instant> nextFireTime(Instant from);

    /**
     * Parses every cron expression of the given trigger.
     *
     * @throws InvalidScheduleException if the trigger is a fixed instant or any expression is malformed
     */
    static List<CronExpressionTrigger> cronTriggers(TriggerSpec spec, ZoneId zone) {
        if (spec instanceof TriggerSpec.At) {
            throw new InvalidScheduleException("A cron-recurring definition needs a cron trigger");
        }
        return spec.cronExpressions().stream()
                .map(expression -> new CronExpressionTrigger(expression, zone))
                .toList();
    }
}
