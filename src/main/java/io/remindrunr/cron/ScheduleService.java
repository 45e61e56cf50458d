package io.remindrunr.cron;

import io.remindrunr.channel.ChannelRegistry;
import io.remindrunr.config.SchedulerProperties;
import io.remindrunr.dispatch.DispatchOutcome;
import io.remindrunr.schedule.InvalidScheduleException;
import io.remindrunr.schedule.NotificationPayload;
import io.remindrunr.schedule.Recurrence;
import io.remindrunr.schedule.ScheduleDefinition;
import io.remindrunr.schedule.ScheduleKind;
import io.remindrunr.schedule.WeatherPayload;
import io.remindrunr.store.ScheduleStore;
import io.remindrunr.store.WeatherSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Manages schedule definitions: validation, persistence and keeping live timers in step.
 *
 * <p>Updates and deletes of the same id are serialized, so the stored record and its live
 * timers always change together.</p>
 */
@Service
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);
    private static final int LOCK_STRIPES = 64;

    private final ScheduleStore store;
    private final DefinitionScheduler scheduler;
    private final JobRegistry registry;
    private final ChannelRegistry channelRegistry;
    private final WeatherSnapshotStore weatherSnapshotStore;
    private final SchedulerProperties properties;
    private final Clock clock;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public ScheduleService(ScheduleStore store, DefinitionScheduler scheduler, JobRegistry registry,
                           ChannelRegistry channelRegistry, WeatherSnapshotStore weatherSnapshotStore,
                           SchedulerProperties properties, Clock clock) {
        this.store = store;
        this.scheduler = scheduler;
        this.registry = registry;
        this.channelRegistry = channelRegistry;
        this.weatherSnapshotStore = weatherSnapshotStore;
        this.properties = properties;
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new Object();
        }
    }

    /**
     * Validates, persists and schedules a new definition.
     * An enabled weather definition is also polled once right away.
     *
     * @throws InvalidScheduleException if the request is malformed or a one-shot is not in the future
     */
    public ScheduleDefinition createDefinition(ScheduleRequest request) {
        Instant now = clock.instant();
        ScheduleDefinition definition = request.toDefinition(UUID.randomUUID().toString(), properties.zone(), now);
        validate(definition);
        if (definition.kind() == ScheduleKind.ONE_SHOT && !definition.triggerInstant().isAfter(now)) {
            throw new InvalidScheduleException("Notification date time must be in the future");
        }

        store.save(definition);
        try {
            scheduler.schedule(definition);
        } catch (RuntimeException e) {
            store.delete(definition.id());
            throw e;
        }
        log.info("Created {} definition {} ('{}')", definition.kind().value(), definition.id(),
                definition.payload().label());

        if (definition.payload() instanceof WeatherPayload && definition.enabled()) {
            scheduler.runNow(definition);
            return store.findById(definition.id()).orElse(definition);
        }
        return definition;
    }

    /**
     * Merges the given fields into a stored definition and reschedules it if its timing changed.
     *
     * @return the updated definition, or empty if the id is unknown
     * @throws InvalidScheduleException if the merged definition is invalid; nothing is stored then
     */
    public Optional<ScheduleDefinition> updateDefinition(String id, ScheduleRequest patch) {
        synchronized (lockFor(id)) {
            AtomicReference<ScheduleDefinition> before = new AtomicReference<>();
            Optional<ScheduleDefinition> updated = store.update(id, current -> {
                before.set(current);
                ScheduleDefinition merged = patch.applyTo(current, clock.instant());
                validate(merged);
                return merged;
            });

            updated.ifPresent(after -> {
                if (affectsTimers(before.get(), after)) {
                    rescheduleOrRestore(before.get(), after);
                }
                log.info("Updated definition {} ('{}')", id, after.payload().label());
            });
            return updated;
        }
    }

    /**
     * Cancels the timers of a definition and removes it from the store, together with
     * any weather snapshots it produced.
     *
     * @return false if the id is unknown
     */
    public boolean deleteDefinition(String id) {
        synchronized (lockFor(id)) {
            scheduler.cancel(id);
            Optional<ScheduleDefinition> existing = store.findById(id);
            boolean deleted = store.delete(id);
            if (deleted) {
                log.info("Deleted definition {}", id);
            }
            if (existing.isPresent() && existing.get().payload() instanceof WeatherPayload) {
                int removed = weatherSnapshotStore.deleteByDefinition(id);
                log.info("Removed {} weather snapshot(s) of definition {}", removed, id);
            }
            return deleted;
        }
    }

    /**
     * Ids of definitions that currently have live timers.
     */
    public List<String> listActiveJobIds() {
        return registry.list();
    }

    public List<ActiveJob> activeJobs() {
        return registry.snapshot();
    }

    public Optional<ScheduleDefinition> getDefinition(String id) {
        return store.findById(id);
    }

    /**
     * Lists matching definitions ordered by creation time.
     */
    public List<ScheduleDefinition> listDefinitions(ScheduleFilter filter) {
        Instant now = clock.instant();
        return store.findAll().stream()
                .filter(definition -> filter.matches(definition, now))
                .sorted(Comparator.comparing(ScheduleDefinition::createdAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Dispatches a definition immediately without changing its schedule.
     *
     * @return the outcome, or empty if the id is unknown
     */
    public Optional<DispatchOutcome> runNow(String id) {
        return store.findById(id).map(scheduler::runNow);
    }

    /**
     * Distinct categories of stored definitions, sorted.
     */
    public List<String> listCategories() {
        return store.findAll().stream()
                .map(definition -> definition.payload().category())
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * Distinct tags of stored definitions, sorted.
     */
    public List<String> listTags() {
        return store.findAll().stream()
                .flatMap(definition -> definition.payload().tags().stream())
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
    }

    public ScheduleStats stats() {
        List<ScheduleDefinition> all = store.findAll();
        int pending = 0;
        int sent = 0;
        int cronEnabled = 0;
        int cronDisabled = 0;
        for (ScheduleDefinition definition : all) {
            if (definition.kind() == ScheduleKind.ONE_SHOT) {
                if (definition.isPending()) {
                    pending++;
                } else {
                    sent++;
                }
            } else if (definition.enabled()) {
                cronEnabled++;
            } else {
                cronDisabled++;
            }
        }
        Map<String, Long> byChannel = all.stream()
                .map(ScheduleDefinition::payload)
                .filter(NotificationPayload.class::isInstance)
                .map(payload -> ((NotificationPayload) payload).channel())
                .collect(Collectors.groupingBy(channel -> channel, TreeMap::new, Collectors.counting()));
        return new ScheduleStats(all.size(), pending, sent, cronEnabled, cronDisabled, byChannel,
                registry.list().size(), registry.timerCount());
    }

    private void validate(ScheduleDefinition definition) {
        switch (definition.kind()) {
            case ONE_SHOT -> {
                Instant at = definition.triggerInstant();
                if (at == null) {
                    throw new InvalidScheduleException("A one-shot definition needs a fixed date time");
                }
                Recurrence recurrence = definition.recurrence();
                if (recurrence != null && recurrence.endDate() != null && !recurrence.endDate().isAfter(at)) {
                    throw new InvalidScheduleException("Repeat end date must be after notification date");
                }
            }
            case CRON_RECURRING -> Trigger.cronTriggers(definition.trigger(), definition.zone());
        }
        if (definition.payload() instanceof WeatherPayload && definition.kind() != ScheduleKind.CRON_RECURRING) {
            throw new InvalidScheduleException("Weather polling needs a cron-recurring definition");
        }
        if (definition.payload() instanceof NotificationPayload notification
                && !channelRegistry.hasChannel(notification.channel())) {
            throw new InvalidScheduleException(
                    "Notification method must be one of: " + String.join(", ", channelRegistry.listChannels()));
        }
    }

    /**
     * Puts the previous record and timers back if the new timers cannot be armed.
     */
    private void rescheduleOrRestore(ScheduleDefinition before, ScheduleDefinition after) {
        try {
            scheduler.reschedule(after);
        } catch (RuntimeException e) {
            log.warn("Rescheduling definition {} failed, restoring previous version: {}", after.id(), e.getMessage());
            store.save(before);
            try {
                scheduler.reschedule(before);
            } catch (RuntimeException restoreError) {
                log.error("Could not restore timers of definition {}", before.id(), restoreError);
                e.addSuppressed(restoreError);
            }
            throw e;
        }
    }

    private Object lockFor(String id) {
        return locks[Math.floorMod(id.hashCode(), LOCK_STRIPES)];
    }

    private static boolean affectsTimers(ScheduleDefinition before, ScheduleDefinition after) {
        return !Objects.equals(before.trigger(), after.trigger())
                || before.enabled() != after.enabled()
                || before.status() != after.status()
                || !Objects.equals(before.timezone(), after.timezone());
    }
}
