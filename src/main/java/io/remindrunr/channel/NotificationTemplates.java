package io.remindrunr.channel;

import io.remindrunr.schedule.FlexibleDates;
import org.springframework.util.StringUtils;
import org.springframework.web.util.HtmlUtils;

import java.time.ZoneId;

/**
 * Renders the e-mail form of a notification. Blank title or message sections are left out.
 */
final class NotificationTemplates {

    private NotificationTemplates() {
    }

    static String subject(Notification notification) {
        return StringUtils.hasText(notification.title())
                ? "Reminder: " + notification.title()
                : "Reminder";
    }

    static String plainText(Notification notification) {
        StringBuilder text = new StringBuilder();
        if (StringUtils.hasText(notification.title())) {
            text.append(notification.title()).append("\n\n");
        }
        if (StringUtils.hasText(notification.message())) {
            text.append(notification.message()).append("\n\n");
        }
        if (StringUtils.hasText(notification.url())) {
            text.append(notification.url()).append("\n\n");
        }
        String scheduledFor = scheduledFor(notification);
        if (scheduledFor != null) {
            text.append("Scheduled for: ").append(scheduledFor).append('\n');
        }
        if (StringUtils.hasText(notification.category())) {
            text.append("Category: ").append(notification.category()).append('\n');
        }
        if (!notification.tags().isEmpty()) {
            text.append("Tags: ").append(String.join(", ", notification.tags())).append('\n');
        }
        return text.toString().stripTrailing();
    }

    static String html(Notification notification) {
        StringBuilder html = new StringBuilder("<html><body>");
        if (StringUtils.hasText(notification.title())) {
            html.append("<h2>").append(HtmlUtils.htmlEscape(notification.title())).append("</h2>");
        }
        if (StringUtils.hasText(notification.message())) {
            html.append("<p>")
                    .append(HtmlUtils.htmlEscape(notification.message()).replace("\n", "<br>"))
                    .append("</p>");
        }
        if (StringUtils.hasText(notification.url())) {
            String url = HtmlUtils.htmlEscape(notification.url());
            html.append("<p><a href=\"").append(url).append("\">").append(url).append("</a></p>");
        }
        String scheduledFor = scheduledFor(notification);
        if (scheduledFor != null) {
            html.append("<p><small>Scheduled for: ").append(HtmlUtils.htmlEscape(scheduledFor)).append("</small></p>");
        }
        if (StringUtils.hasText(notification.category())) {
            html.append("<p><small>Category: ").append(HtmlUtils.htmlEscape(notification.category())).append("</small></p>");
        }
        if (!notification.tags().isEmpty()) {
            html.append("<p><small>Tags: ")
                    .append(HtmlUtils.htmlEscape(String.join(", ", notification.tags())))
                    .append("</small></p>");
        }
        return html.append("</body></html>").toString();
    }

    private static String scheduledFor(Notification notification) {
        if (notification.scheduledFor() == null) {
            return null;
        }
        ZoneId zone = notification.timezone() == null ? ZoneId.systemDefault() : ZoneId.of(notification.timezone());
        return FlexibleDates.format(notification.scheduledFor(), zone) + " (" + zone.getId() + ")";
    }
}
