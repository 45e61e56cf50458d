package io.remindrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Notification channel settings, bound to {@code remindrunr.notifications}.
 *
 * <pre>
 * remindrunr:
 *   notifications:
 *     webhook:
 *       url: ${WEBHOOK_URL:}
 *       timeout: 10s
 *     email:
 *       from: ${EMAIL_FROM:}
 *       to: ${EMAIL_TO:}
 * </pre>
 */
@ConfigurationProperties(prefix = "remindrunr.notifications")
public record NotificationProperties(Webhook webhook, Email email) {

    public NotificationProperties {
        if (webhook == null) {
            webhook = new Webhook(null, null);
        }
        if (email == null) {
            email = new Email(null, null);
        }
    }

    /**
     * @param url     endpoint receiving the POST; blank disables the channel
     * @param timeout bound on connect and read
     */
    public record Webhook(String url, Duration timeout) {
        public Webhook {
            if (timeout == null) {
                timeout = Duration.ofSeconds(10);
            }
        }
    }

    public record Email(String from, String to) {
    }
}
