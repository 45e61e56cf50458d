package io.remindrunr.cron;

import java.time.Instant;
import java.util.Optional;

/**
 * Fires once at a fixed instant. An instant that is not after {@code from} never fires.
 */
public record FixedInstantTrigger(Instant at) implements Trigger {

    @Override
    public Optional<Instant> nextFireTime(Instant from) {
        return at.isAfter(from) ? Optional.of(at) : Optional.empty();
    }
}
