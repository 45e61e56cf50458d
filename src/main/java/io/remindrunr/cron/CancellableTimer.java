package io.remindrunr.cron;

import java.time.Instant;
import java.util.Optional;

/**
 * A live timer backing one trigger of a definition.
 */
public interface CancellableTimer {

    /**
     * Unique key of this timer. Firings carry the key so a superseded timer can be recognised.
     */
    String key();

    /**
     * Next instant at which this timer fires, if any.
     */
    Optional<Instant> nextFireTime();

    /**
     * Prevents future firings. Has no effect on a firing already in progress.
     */
    void cancel();
}
