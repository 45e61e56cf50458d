package io.remindrunr.cron;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.remindrunr.schedule.CronValues;
import io.remindrunr.schedule.DeliveryStatus;
import io.remindrunr.schedule.FlexibleDates;
import io.remindrunr.schedule.InvalidScheduleException;
import io.remindrunr.schedule.NotificationPayload;
import io.remindrunr.schedule.Payload;
import io.remindrunr.schedule.PromptPayload;
import io.remindrunr.schedule.Recurrence;
import io.remindrunr.schedule.RecurrenceInterval;
import io.remindrunr.schedule.ScheduleDefinition;
import io.remindrunr.schedule.ScheduleKind;
import io.remindrunr.schedule.TriggerSpec;
import io.remindrunr.schedule.WeatherPayload;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * Request body for creating or updating a definition.
 *
 * <p>For updates every field is optional and only the given ones change. When {@code kind}
 * is omitted on create it is inferred: a cron value or a location means {@code cron-recurring},
 * anything else {@code one-shot}. A {@code prompt} value selects a prompt payload, a
 * {@code latitude}/{@code longitude} pair a weather payload, otherwise a notification payload
 * is built. Weather definitions without a cron value poll hourly.</p>
 *
 * @param at              fire time of a one-shot, ISO-8601 or {@code YYYY/M/D HH:MM}
 * @param cron            a single expression or a JSON array of expressions encoded as a string
 * @param cronExpressions expressions as a JSON list, takes precedence over {@code cron}
 */
public record ScheduleRequest(
        String kind,
        @JsonAlias("notificationDateTime") String at,
        @JsonAlias("cronExpression") String cron,
        List<String> cronExpressions,
        Boolean enabled,
        @JsonAlias("notificationStatus") String status,
        @JsonAlias("repeatSettings") RecurrenceRequest recurrence,
        String timezone,
        String title,
        String message,
        String url,
        @JsonAlias("notificationMethod") String channel,
        String name,
        String prompt,
        String category,
        List<String> tags,
        Double latitude,
        Double longitude
) {

    /**
     * @param endDate ISO-8601 or {@code YYYY/M/D HH:MM}
     */
    public record RecurrenceRequest(String interval, String endDate, Integer maxOccurrences) {

        Recurrence toRecurrence(ZoneId zone, int currentOccurrence) {
            if (interval == null || interval.isBlank()) {
                throw new InvalidScheduleException("Repeat interval must be one of: daily, weekly, monthly, yearly");
            }
            Instant end = null;
            if (endDate != null && !endDate.isBlank()) {
                try {
                    end = FlexibleDates.parse(endDate, zone);
                } catch (InvalidScheduleException e) {
                    throw new InvalidScheduleException(
                            "Invalid repeat end date format. Expected format: \"YYYY/M/D HH:MM\" or ISO 8601", e);
                }
            }
            return new Recurrence(RecurrenceInterval.fromValue(interval), end, maxOccurrences, currentOccurrence);
        }
    }

    /**
     * Builds a new definition from this request.
     *
     * @throws InvalidScheduleException if required fields are missing or malformed
     */
    ScheduleDefinition toDefinition(String id, ZoneId defaultZone, Instant now) {
        ZoneId zone = resolveZone(defaultZone);
        Payload payload = buildPayload();
        return switch (resolveKind()) {
            case ONE_SHOT -> {
                if (at == null || at.isBlank()) {
                    throw new InvalidScheduleException("Notification date time is required");
                }
                Recurrence rule = recurrence == null ? null : recurrence.toRecurrence(zone, 1);
                yield ScheduleDefinition.oneShot(id, parseInstant(at, zone), payload, rule, zone.getId(), now);
            }
            case CRON_RECURRING -> {
                if (recurrence != null) {
                    throw new InvalidScheduleException("Repeat settings apply to one-shot definitions only");
                }
                TriggerSpec trigger = payload instanceof WeatherPayload && !hasCron()
                        ? TriggerSpec.single(WeatherPayload.DEFAULT_CRON)
                        : cronTrigger();
                yield ScheduleDefinition.cronRecurring(id, trigger, payload,
                        enabled == null || enabled, zone.getId(), now);
            }
        };
    }

    /**
     * Merges the given fields into an existing definition.
     *
     * @throws InvalidScheduleException if a field is malformed or the kind would change
     */
    ScheduleDefinition applyTo(ScheduleDefinition current, Instant now) {
        if (kind != null && ScheduleKind.fromValue(kind) != current.kind()) {
            throw new InvalidScheduleException("Kind cannot be changed");
        }
        ZoneId zone = timezone == null ? current.zone() : resolveZone(current.zone());

        TriggerSpec trigger = current.trigger();
        Recurrence rule = current.recurrence();
        if (current.kind() == ScheduleKind.ONE_SHOT) {
            if (at != null) {
                trigger = TriggerSpec.at(parseInstant(at, zone));
            }
            if (recurrence != null) {
                int occurrence = rule == null ? 1 : rule.currentOccurrence();
                rule = recurrence.toRecurrence(zone, occurrence);
            }
        } else {
            if (hasCron()) {
                trigger = cronTrigger();
            }
            if (recurrence != null) {
                throw new InvalidScheduleException("Repeat settings apply to one-shot definitions only");
            }
        }

        return new ScheduleDefinition(current.id(), current.kind(), trigger, mergePayload(current.payload()),
                enabled == null ? current.enabled() : enabled,
                status == null ? current.status() : DeliveryStatus.fromValue(status),
                rule, zone.getId(), current.lastFiredAt(), current.lastError(), current.createdAt(), now);
    }

    private ScheduleKind resolveKind() {
        if (kind != null) {
            return ScheduleKind.fromValue(kind);
        }
        return hasCron() || isWeather() ? ScheduleKind.CRON_RECURRING : ScheduleKind.ONE_SHOT;
    }

    private boolean hasCron() {
        return cron != null || cronExpressions != null;
    }

    private boolean isWeather() {
        return prompt == null && (latitude != null || longitude != null);
    }

    private ZoneId resolveZone(ZoneId fallback) {
        if (timezone == null || timezone.isBlank()) {
            return fallback;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new InvalidScheduleException("Unknown timezone: " + timezone, e);
        }
    }

    private TriggerSpec cronTrigger() {
        if (cronExpressions != null) {
            return cronExpressions.size() == 1
                    ? TriggerSpec.single(cronExpressions.get(0))
                    : TriggerSpec.multiple(cronExpressions);
        }
        return CronValues.toTrigger(cron);
    }

    private Payload buildPayload() {
        if (prompt != null) {
            return new PromptPayload(name != null ? name : title, prompt, category, tags);
        }
        if (isWeather()) {
            return new WeatherPayload(name != null ? name : title, latitude, longitude, category, tags);
        }
        return new NotificationPayload(title, message, url, channel, category, tags);
    }

    private Payload mergePayload(Payload current) {
        if (current instanceof PromptPayload p) {
            return new PromptPayload(
                    name != null ? name : p.name(),
                    prompt != null ? prompt : p.prompt(),
                    category != null ? category : p.category(),
                    tags != null ? tags : p.tags());
        }
        if (current instanceof WeatherPayload w) {
            String newName = name != null ? name : title;
            return new WeatherPayload(
                    newName != null ? newName : w.name(),
                    latitude != null ? latitude : w.latitude(),
                    longitude != null ? longitude : w.longitude(),
                    category != null ? category : w.category(),
                    tags != null ? tags : w.tags());
        }
        NotificationPayload n = (NotificationPayload) current;
        if (title != null && title.isBlank()) {
            throw new InvalidScheduleException("Title cannot be empty");
        }
        return new NotificationPayload(
                title != null ? title : n.title(),
                message != null ? message : n.message(),
                url != null ? url : n.url(),
                channel != null ? channel : n.channel(),
                category != null ? category : n.category(),
                tags != null ? tags : n.tags());
    }

    private static Instant parseInstant(String value, ZoneId zone) {
        try {
            return FlexibleDates.parse(value, zone);
        } catch (InvalidScheduleException e) {
            throw new InvalidScheduleException(
                    "Invalid notification date time format. Expected format: \"YYYY/M/D HH:MM\" or ISO 8601", e);
        }
    }
}
