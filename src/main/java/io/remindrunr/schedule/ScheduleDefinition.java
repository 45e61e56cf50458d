package io.remindrunr.schedule;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;

/**
 * A persisted description of something to be scheduled: trigger, payload and recurrence.
 *
 * <p>Instances are immutable; every state change produces a new record that is
 * written back to the store as a whole.</p>
 *
 * @param id          unique identifier, stable across reschedules
 * @param kind        one-shot or cron-recurring
 * @param trigger     when the definition fires
 * @param payload     what happens when it fires
 * @param enabled     whether live timers exist (cron-recurring only)
 * @param status      pending or sent (one-shot only)
 * @param recurrence  optional follow-up rule (one-shot only)
 * @param timezone    zone used for cron evaluation and calendar arithmetic
 * @param lastFiredAt instant of the last successful dispatch
 * @param lastError   error text of the last failed dispatch, cleared on success
 * @param createdAt   creation instant
 * @param updatedAt   last modification instant
 */
public record ScheduleDefinition(
        String id,
        ScheduleKind kind,
        TriggerSpec trigger,
        Payload payload,
        boolean enabled,
        DeliveryStatus status,
        Recurrence recurrence,
        String timezone,
        Instant lastFiredAt,
        String lastError,
        Instant createdAt,
        Instant updatedAt
) {
    public ScheduleDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(trigger, "trigger");
        Objects.requireNonNull(payload, "payload");
        if (status == null) {
            status = DeliveryStatus.PENDING;
        }
    }

    /**
     * Creates a new pending one-shot definition.
     */
    public static ScheduleDefinition oneShot(String id, Instant at, Payload payload, Recurrence recurrence,
                                             String timezone, Instant now) {
        return new ScheduleDefinition(id, ScheduleKind.ONE_SHOT, TriggerSpec.at(at), payload, true,
                DeliveryStatus.PENDING, recurrence, timezone, null, null, now, now);
    }

    /**
     * Creates a new cron-recurring definition.
     */
    public static ScheduleDefinition cronRecurring(String id, TriggerSpec trigger, Payload payload, boolean enabled,
                                                   String timezone, Instant now) {
        return new ScheduleDefinition(id, ScheduleKind.CRON_RECURRING, trigger, payload, enabled,
                DeliveryStatus.PENDING, null, timezone, null, null, now, now);
    }

    @JsonIgnore
    public ZoneId zone() {
        return timezone == null ? ZoneId.systemDefault() : ZoneId.of(timezone);
    }

    @JsonIgnore
    public boolean isPending() {
        return status == DeliveryStatus.PENDING;
    }

    /**
     * Returns the fixed trigger instant of a one-shot definition, or null for cron definitions.
     */
    @JsonIgnore
    public Instant triggerInstant() {
        return trigger instanceof TriggerSpec.At at ? at.at() : null;
    }

    public ScheduleDefinition markSent(Instant firedAt) {
        return new ScheduleDefinition(id, kind, trigger, payload, enabled, DeliveryStatus.SENT, recurrence,
                timezone, firedAt, null, createdAt, firedAt);
    }

    public ScheduleDefinition markFired(Instant firedAt) {
        return new ScheduleDefinition(id, kind, trigger, payload, enabled, status, recurrence,
                timezone, firedAt, null, createdAt, firedAt);
    }

    public ScheduleDefinition markFailed(String error, Instant failedAt) {
        return new ScheduleDefinition(id, kind, trigger, payload, enabled, status, recurrence,
                timezone, lastFiredAt, error, createdAt, failedAt);
    }

    /**
     * Builds the independent pending definition representing the next occurrence.
     */
    public ScheduleDefinition nextOccurrence(String newId, Instant nextAt, Instant now) {
        return new ScheduleDefinition(newId, kind, TriggerSpec.at(nextAt), payload, enabled,
                DeliveryStatus.PENDING, recurrence == null ? null : recurrence.advance(), timezone,
                null, null, now, now);
    }
}
