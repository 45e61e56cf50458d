package io.remindrunr.channel;

import io.remindrunr.schedule.NotificationPayload;
import io.remindrunr.schedule.ScheduleDefinition;

import java.time.Instant;
import java.util.List;

/**
 * A reminder ready for delivery.
 *
 * @param scheduledFor intended trigger time, null for ad-hoc notifications
 */
public record Notification(
        String id,
        String title,
        String message,
        String url,
        Instant scheduledFor,
        String timezone,
        String category,
        List<String> tags
) {
    public Notification {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static Notification from(ScheduleDefinition definition, NotificationPayload payload) {
        return new Notification(definition.id(), payload.title(), payload.message(), payload.url(),
                definition.triggerInstant(), definition.zone().getId(), payload.category(), payload.tags());
    }
}
