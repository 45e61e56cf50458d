package io.remindrunr.schedule;

import java.util.List;

/**
 * A notification delivered through a named channel ({@code webhook} or {@code email}).
 *
 * @param title    notification title (required)
 * @param message  optional body text
 * @param url      optional link included with the notification
 * @param channel  channel name
 * @param category optional grouping
 * @param tags     free-form tags
 */
public record NotificationPayload(
        String title,
        String message,
        String url,
        String channel,
        String category,
        List<String> tags
) implements Payload {

    public static final String DEFAULT_CHANNEL = "webhook";

    public NotificationPayload {
        if (title == null || title.isBlank()) {
            throw new InvalidScheduleException("Title is required");
        }
        title = title.trim();
        if (channel == null || channel.isBlank()) {
            channel = DEFAULT_CHANNEL;
        }
        if (tags == null) {
            tags = List.of();
        }
    }

    @Override
    public String label() {
        return title;
    }
}
