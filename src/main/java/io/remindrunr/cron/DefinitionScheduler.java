package io.remindrunr.cron;

import io.remindrunr.dispatch.DispatchOutcome;
import io.remindrunr.dispatch.Dispatcher;
import io.remindrunr.schedule.Recurrence;
import io.remindrunr.schedule.ScheduleDefinition;
import io.remindrunr.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps the {@link JobRegistry} consistent with schedule definitions and handles timer firings.
 *
 * <p>One-shot definitions get a single timer while they are pending and due in the future.
 * Cron definitions get one timer per expression while enabled. Firing a one-shot marks it
 * sent and, if its recurrence allows, persists and schedules the next occurrence as a new
 * definition. Failed dispatches are recorded and never retried.</p>
 */
@Service
public class DefinitionScheduler {

    private static final Logger log = LoggerFactory.getLogger(DefinitionScheduler.class);

    private final JobRegistry registry;
    private final TimerService timerService;
    private final ScheduleStore store;
    private final Dispatcher dispatcher;
    private final RecurrenceCalculator recurrenceCalculator;
    private final Clock clock;

    public DefinitionScheduler(JobRegistry registry, TimerService timerService, ScheduleStore store,
                               Dispatcher dispatcher, RecurrenceCalculator recurrenceCalculator, Clock clock) {
        this.registry = registry;
        this.timerService = timerService;
        this.store = store;
        this.dispatcher = dispatcher;
        this.recurrenceCalculator = recurrenceCalculator;
        this.clock = clock;
    }

    /**
     * Installs timers for the definition.
     *
     * @return true if at least one timer was armed
     * @throws io.remindrunr.schedule.InvalidScheduleException if a cron expression is malformed
     */
    public boolean schedule(ScheduleDefinition definition) {
        return switch (definition.kind()) {
            case ONE_SHOT -> scheduleOneShot(definition);
            case CRON_RECURRING -> scheduleCron(definition);
        };
    }

    /**
     * Cancels any live timers of the definition, then schedules it again.
     */
    public boolean reschedule(ScheduleDefinition definition) {
        registry.cancel(definition.id());
        return schedule(definition);
    }

    /**
     * Cancels live timers only; the stored definition is untouched. Unknown ids are ignored.
     */
    public void cancel(String definitionId) {
        if (registry.cancel(definitionId)) {
            log.info("Cancelled timers of definition {}", definitionId);
        }
    }

    private boolean scheduleOneShot(ScheduleDefinition definition) {
        if (!definition.isPending()) {
            log.debug("Definition {} is {}, not scheduling", definition.id(), definition.status().value());
            return false;
        }

        Optional<Instant> fireAt = new FixedInstantTrigger(definition.triggerInstant()).nextFireTime(clock.instant());
        if (fireAt.isEmpty()) {
            log.info("Definition {} ('{}') was due at {}, which has passed; leaving it unscheduled",
                    definition.id(), definition.payload().label(), definition.triggerInstant());
            return false;
        }

        CancellableTimer timer = timerService.scheduleOnce(definition.id(), fireAt.get());
        registry.set(definition.id(), List.of(timer));
        log.info("Scheduled definition {} ('{}') for {}", definition.id(), definition.payload().label(), fireAt.get());
        return true;
    }

    private boolean scheduleCron(ScheduleDefinition definition) {
        if (!definition.enabled()) {
            registry.cancel(definition.id());
            log.debug("Definition {} is disabled, no timers armed", definition.id());
            return false;
        }

        List<CronExpressionTrigger> triggers = Trigger.cronTriggers(definition.trigger(), definition.zone());
        List<CancellableTimer> timers = new ArrayList<>();
        try {
            for (CronExpressionTrigger trigger : triggers) {
                timers.add(timerService.scheduleCron(definition.id(), trigger));
            }
        } catch (RuntimeException e) {
            timers.forEach(CancellableTimer::cancel);
            throw e;
        }

        registry.set(definition.id(), timers);
        log.info("Scheduled definition {} ('{}') with {} cron timer(s): {}", definition.id(),
                definition.payload().label(), timers.size(), definition.trigger().cronExpressions());
        return true;
    }

    /**
     * Handles the firing of a one-shot timer.
     * Stale firings, whose timer was cancelled or replaced, are skipped.
     */
    public void fireOnce(String definitionId, String timerKey) {
        if (!registry.release(definitionId, timerKey)) {
            log.info("Skipping stale one-shot firing of definition {}", definitionId);
            return;
        }

        Optional<ScheduleDefinition> stored = store.findById(definitionId);
        if (stored.isEmpty()) {
            log.warn("Definition {} fired but no longer exists", definitionId);
            return;
        }
        ScheduleDefinition definition = stored.get();
        if (!definition.isPending()) {
            log.info("Definition {} fired but is already {}", definitionId, definition.status().value());
            return;
        }

        log.info("Firing definition {} ('{}')", definitionId, definition.payload().label());
        DispatchOutcome outcome = dispatcher.dispatch(definition);
        Instant now = clock.instant();

        if (!outcome.succeeded()) {
            store.update(definitionId, current -> current.markFailed(outcome.error(), now));
            log.warn("Dispatch of definition {} failed, left pending: {}", definitionId, outcome.error());
            return;
        }

        store.update(definitionId, current -> current.markSent(now));
        log.info("Definition {} sent", definitionId);
        scheduleNextOccurrence(definition, now);
    }

    /**
     * Handles the firing of one cron timer of a definition.
     */
    public void fireCron(String definitionId, String timerKey) {
        if (!registry.owns(definitionId, timerKey)) {
            log.info("Skipping stale cron firing of definition {}", definitionId);
            return;
        }

        Optional<ScheduleDefinition> stored = store.findById(definitionId);
        if (stored.isEmpty() || !stored.get().enabled()) {
            log.info("Definition {} fired but is deleted or disabled", definitionId);
            return;
        }
        ScheduleDefinition definition = stored.get();

        log.info("Firing cron definition {} ('{}')", definitionId, definition.payload().label());
        DispatchOutcome outcome = dispatcher.dispatch(definition);
        record(definitionId, outcome);
    }

    /**
     * Dispatches a definition immediately, outside its schedule. Status and timers are untouched.
     */
    public DispatchOutcome runNow(ScheduleDefinition definition) {
        log.info("Running definition {} ('{}') immediately", definition.id(), definition.payload().label());
        DispatchOutcome outcome = dispatcher.dispatch(definition);
        record(definition.id(), outcome);
        return outcome;
    }

    private void record(String definitionId, DispatchOutcome outcome) {
        Instant now = clock.instant();
        if (outcome.succeeded()) {
            store.update(definitionId, current -> current.markFired(now));
            log.info("Definition {} dispatched", definitionId);
        } else {
            store.update(definitionId, current -> current.markFailed(outcome.error(), now));
            log.warn("Dispatch of definition {} failed: {}", definitionId, outcome.error());
        }
    }

    private void scheduleNextOccurrence(ScheduleDefinition fired, Instant now) {
        Recurrence recurrence = fired.recurrence();
        if (recurrence == null) {
            return;
        }

        Optional<Instant> nextAt = recurrenceCalculator.nextOccurrence(
                fired.triggerInstant(), recurrence, fired.zone());
        if (nextAt.isEmpty()) {
            log.info("Recurrence of definition {} has ended after occurrence {}",
                    fired.id(), recurrence.currentOccurrence());
            return;
        }

        ScheduleDefinition next = store.save(
                fired.nextOccurrence(UUID.randomUUID().toString(), nextAt.get(), now));
        log.info("Created occurrence {} of '{}' as definition {} at {}",
                next.recurrence().currentOccurrence(), next.payload().label(), next.id(), nextAt.get());
        schedule(next);
    }
}
