package io.remindrunr.cron;

import io.remindrunr.schedule.NotificationPayload;
import io.remindrunr.schedule.ScheduleDefinition;
import io.remindrunr.schedule.ScheduleKind;

import java.time.Duration;
import java.time.Instant;

/**
 * Optional criteria for listing definitions. Null fields match everything.
 *
 * @param channel       matches notification payloads sent through this channel
 * @param upcomingHours matches pending one-shots due within this many hours
 */
public record ScheduleFilter(String kind, String status, String channel, String category, Integer upcomingHours) {

    public static ScheduleFilter none() {
        return new ScheduleFilter(null, null, null, null, null);
    }

    public boolean matches(ScheduleDefinition definition, Instant now) {
        if (kind != null && !kind.equalsIgnoreCase(definition.kind().value())) {
            return false;
        }
        if (status != null && !status.equalsIgnoreCase(definition.status().value())) {
            return false;
        }
        if (channel != null && !(definition.payload() instanceof NotificationPayload n && channel.equals(n.channel()))) {
            return false;
        }
        if (category != null && !category.equals(definition.payload().category())) {
            return false;
        }
        if (upcomingHours != null) {
            return isUpcoming(definition, now, now.plus(Duration.ofHours(upcomingHours)));
        }
        return true;
    }

    private static boolean isUpcoming(ScheduleDefinition definition, Instant now, Instant until) {
        if (definition.kind() != ScheduleKind.ONE_SHOT || !definition.isPending()) {
            return false;
        }
        Instant at = definition.triggerInstant();
        return at.isAfter(now) && !at.isAfter(until);
    }
}
