package io.remindrunr.cron;

import java.time.Instant;

/**
 * Creates timers that call back into {@link DefinitionScheduler} when they fire.
 */
public interface TimerService {

    /**
     * Arms a timer that fires once at {@code fireAt}.
     */
    CancellableTimer scheduleOnce(String definitionId, Instant fireAt);

    /**
     * Arms a timer that fires on every match of {@code trigger} until cancelled.
     */
    CancellableTimer scheduleCron(String definitionId, CronExpressionTrigger trigger);
}
