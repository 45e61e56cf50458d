package io.remindrunr.cron;

import io.remindrunr.dispatch.DispatchOutcome;
import io.remindrunr.schedule.DeliveryStatus;
import io.remindrunr.schedule.NotificationPayload;
import io.remindrunr.schedule.PromptPayload;
import io.remindrunr.schedule.Recurrence;
import io.remindrunr.schedule.RecurrenceInterval;
import io.remindrunr.schedule.ScheduleDefinition;
import io.remindrunr.schedule.TriggerSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefinitionSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private InMemoryScheduleStore store;
    private JobRegistry registry;
    private RecordingTimerService timers;
    private StubDispatcher dispatcher;
    private DefinitionScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduleStore();
        registry = new JobRegistry();
        timers = new RecordingTimerService();
        dispatcher = new StubDispatcher();
        scheduler = new DefinitionScheduler(registry, timers, store, dispatcher, new RecurrenceCalculator(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void pastOneShotShouldLeaveRegistryUnchanged() {
        var definition = reminder("past", Instant.parse("2024-12-31T23:59:00Z"), null);

        assertFalse(scheduler.schedule(definition));

        assertTrue(registry.list().isEmpty());
        assertTrue(timers.timers.isEmpty());
    }

    @Test
    void futureOneShotShouldArmSingleTimer() {
        var at = Instant.parse("2025-01-06T09:00:00Z");

        assertTrue(scheduler.schedule(reminder("r1", at, null)));

        assertEquals(List.of("r1"), registry.list());
        assertEquals(at, timers.last().fireAt);
    }

    @Test
    void sentOneShotShouldNotBeScheduled() {
        var sent = reminder("r1", Instant.parse("2025-01-06T09:00:00Z"), null).markSent(NOW);

        assertFalse(scheduler.schedule(sent));
        assertTrue(registry.list().isEmpty());
    }

    @Test
    void cronDefinitionShouldArmOneTimerPerExpression() {
        var definition = cron("c1", TriggerSpec.multiple(List.of("0 9 * * *", "0 18 * * *")), true);

        assertTrue(scheduler.schedule(definition));

        assertEquals(2, registry.get("c1").orElseThrow().timers().size());
        assertEquals(List.of("0 9 * * *", "0 18 * * *"),
                timers.timers.stream().map(t -> t.trigger.expression()).toList());
    }

    @Test
    void disabledCronShouldHaveNoTimers() {
        scheduler.schedule(cron("c1", TriggerSpec.single("0 9 * * *"), true));

        scheduler.reschedule(cron("c1", TriggerSpec.single("0 9 * * *"), false));

        assertTrue(registry.get("c1").isEmpty());
        assertTrue(timers.liveTimers().isEmpty());
    }

    @Test
    void rescheduleShouldReplaceTimers() {
        scheduler.schedule(reminder("r1", Instant.parse("2025-01-06T09:00:00Z"), null));

        scheduler.reschedule(reminder("r1", Instant.parse("2025-01-08T09:00:00Z"), null));

        assertEquals(1, timers.liveTimers().size());
        assertEquals(Instant.parse("2025-01-08T09:00:00Z"), timers.liveTimers().get(0).fireAt);
    }

    @Test
    void cancelShouldKeepStoredDefinition() {
        var definition = store.save(reminder("r1", Instant.parse("2025-01-06T09:00:00Z"), null));
        scheduler.schedule(definition);

        scheduler.cancel("r1");
        scheduler.cancel("r1");

        assertTrue(registry.list().isEmpty());
        assertTrue(store.findById("r1").isPresent());
    }

    @Test
    void firingShouldMarkOneShotSent() {
        var definition = store.save(reminder("r1", Instant.parse("2025-01-06T09:00:00Z"), null));
        scheduler.schedule(definition);

        scheduler.fireOnce("r1", timers.last().key());

        var stored = store.findById("r1").orElseThrow();
        assertEquals(DeliveryStatus.SENT, stored.status());
        assertEquals(NOW, stored.lastFiredAt());
        assertTrue(registry.list().isEmpty());
        assertEquals(1, dispatcher.dispatched.size());
        assertEquals(1, store.findAll().size());
    }

    @Test
    void firingWithRecurrenceShouldCreateNextOccurrence() {
        var at = Instant.parse("2025-01-06T09:00:00Z");
        var definition = store.save(reminder("r1", at, Recurrence.of(RecurrenceInterval.WEEKLY, null, 3)));
        scheduler.schedule(definition);

        scheduler.fireOnce("r1", timers.last().key());

        assertEquals(DeliveryStatus.SENT, store.findById("r1").orElseThrow().status());
        var next = store.findAll().stream().filter(d -> !d.id().equals("r1")).findFirst().orElseThrow();
        assertEquals(DeliveryStatus.PENDING, next.status());
        assertEquals(Instant.parse("2025-01-13T09:00:00Z"), next.triggerInstant());
        assertEquals(2, next.recurrence().currentOccurrence());
        assertEquals(List.of(next.id()), registry.list());
        assertEquals(Instant.parse("2025-01-13T09:00:00Z"), timers.last().fireAt);
    }

    @Test
    void firingLastOccurrenceShouldNotCreateAnother() {
        var definition = store.save(reminder("r3", Instant.parse("2025-01-20T09:00:00Z"),
                new Recurrence(RecurrenceInterval.WEEKLY, null, 3, 3)));
        scheduler.schedule(definition);

        scheduler.fireOnce("r3", timers.last().key());

        assertEquals(1, store.findAll().size());
        assertEquals(DeliveryStatus.SENT, store.findById("r3").orElseThrow().status());
        assertTrue(registry.list().isEmpty());
    }

    @Test
    void failedDispatchShouldLeaveDefinitionPendingWithoutRetry() {
        dispatcher.outcome = DispatchOutcome.failure("Webhook returned HTTP 500");
        var definition = store.save(reminder("r1", Instant.parse("2025-01-06T09:00:00Z"),
                Recurrence.of(RecurrenceInterval.DAILY, null, null)));
        scheduler.schedule(definition);

        scheduler.fireOnce("r1", timers.last().key());

        var stored = store.findById("r1").orElseThrow();
        assertEquals(DeliveryStatus.PENDING, stored.status());
        assertEquals("Webhook returned HTTP 500", stored.lastError());
        assertEquals(1, store.findAll().size());
        assertTrue(registry.list().isEmpty());
        assertEquals(1, timers.timers.size());
    }

    @Test
    void staleFiringShouldBeSkipped() {
        var definition = store.save(reminder("r1", Instant.parse("2025-01-06T09:00:00Z"), null));
        scheduler.schedule(definition);
        String oldKey = timers.last().key();
        scheduler.reschedule(definition);

        scheduler.fireOnce("r1", oldKey);

        assertTrue(dispatcher.dispatched.isEmpty());
        assertEquals(List.of("r1"), registry.list());
    }

    @Test
    void firingDeletedDefinitionShouldNotDispatch() {
        var definition = reminder("r1", Instant.parse("2025-01-06T09:00:00Z"), null);
        scheduler.schedule(definition);

        scheduler.fireOnce("r1", timers.last().key());

        assertTrue(dispatcher.dispatched.isEmpty());
    }

    @Test
    void cronFiringShouldRecordLastFiredAt() {
        var definition = store.save(cron("c1", TriggerSpec.single("0 9 * * *"), true));
        scheduler.schedule(definition);

        scheduler.fireCron("c1", timers.last().key());

        var stored = store.findById("c1").orElseThrow();
        assertEquals(NOW, stored.lastFiredAt());
        assertNull(stored.lastError());
        assertEquals(List.of("c1"), registry.list(), "cron timers stay armed");
    }

    @Test
    void cronFiringFailureShouldRecordError() {
        dispatcher.outcome = DispatchOutcome.failure("Completion timed out after 30s");
        var definition = store.save(cron("c1", TriggerSpec.single("0 9 * * *"), true));
        scheduler.schedule(definition);

        scheduler.fireCron("c1", timers.last().key());

        assertEquals("Completion timed out after 30s", store.findById("c1").orElseThrow().lastError());
    }

    @Test
    void cancelledCronTimerShouldNotDispatch() {
        var definition = store.save(cron("c1", TriggerSpec.single("0 9 * * *"), true));
        scheduler.schedule(definition);
        String key = timers.last().key();
        scheduler.cancel("c1");

        scheduler.fireCron("c1", key);

        assertTrue(dispatcher.dispatched.isEmpty());
    }

    @Test
    void runNowShouldDispatchWithoutTouchingTimers() {
        var definition = store.save(reminder("r1", Instant.parse("2025-01-06T09:00:00Z"), null));
        scheduler.schedule(definition);

        var outcome = scheduler.runNow(definition);

        assertTrue(outcome.succeeded());
        assertEquals(DeliveryStatus.PENDING, store.findById("r1").orElseThrow().status());
        assertEquals(List.of("r1"), registry.list());
    }

    private static ScheduleDefinition reminder(String id, Instant at, Recurrence recurrence) {
        return ScheduleDefinition.oneShot(id, at,
                new NotificationPayload("Stand-up", "Daily sync", null, "webhook", null, null),
                recurrence, "UTC", NOW);
    }

    private static ScheduleDefinition cron(String id, TriggerSpec trigger, boolean enabled) {
        return ScheduleDefinition.cronRecurring(id, trigger,
                new PromptPayload("Digest", "Summarize the news", null, null), enabled, "Asia/Tokyo", NOW);
    }
}
