package io.remindrunr.cron;

import io.remindrunr.schedule.InvalidScheduleException;
import org.jobrunr.scheduling.cron.CronExpression;
import org.jobrunr.scheduling.cron.InvalidCronExpressionException;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Standard 5-field cron trigger: minute, hour, day-of-month, month, day-of-week.
 *
 * <p>Expressions are parsed with JobRunr's {@link CronExpression}, the same parser that arms the
 * recurring job, so an expression accepted here is never rejected when the timer is created and
 * the reported next fire time is the one JobRunr will use. A restricted day-of-month and a restricted
 * day-of-week are combined with OR, as in classic cron.</p>
 */
public final class CronExpressionTrigger implements Trigger {

    private static final int FIELD_COUNT = 5;

    private final String expression;
    private final ZoneId zone;
    private final CronExpression cron;

    public CronExpressionTrigger(String expression, ZoneId zone) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Cron expression is required");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != FIELD_COUNT) {
            throw new InvalidScheduleException(("Invalid cron expression format: \"%s\". "
                    + "Expected 5 parts (minute hour day month dayOfWeek)").formatted(expression));
        }
        this.expression = String.join(" ", fields);
        this.zone = zone;
        try {
            this.cron = CronExpression.create(this.expression);
        } catch (InvalidCronExpressionException | IllegalArgumentException e) {
            throw new InvalidScheduleException(
                    "Invalid cron expression \"%s\": %s".formatted(expression, e.getMessage()), e);
        }
    }

    @Override
    public Optional<Instant> nextFireTime(Instant from) {
        Instant next = cron.next(from, from, zone);
        if (next != null && !next.isAfter(from)) {
            next = cron.next(from, from.plusSeconds(1), zone);
        }
        return Optional.ofNullable(next);
    }

    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public String toString() {
        return "cron(" + expression + " " + zone + ")";
    }
}
