package io.remindrunr.cron;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Live timers of one definition.
 */
public record ActiveJob(String definitionId, List<CancellableTimer> timers) {

    public ActiveJob {
        timers = List.copyOf(timers);
    }

    public boolean owns(String timerKey) {
        return timers.stream().anyMatch(timer -> timer.key().equals(timerKey));
    }

    /**
     * Earliest next fire time across all timers.
     */
    public Optional<Instant> nextFireTime() {
        return timers.stream()
                .map(CancellableTimer::nextFireTime)
                .flatMap(Optional::stream)
                .min(Comparator.naturalOrder());
    }

    void cancelAll() {
        timers.forEach(CancellableTimer::cancel);
    }
}
