package io.remindrunr.channel;

import io.remindrunr.dispatch.DeliveryException;

/**
 * A delivery channel for reminders.
 * Implementations send a notification to their destination (webhook, e-mail).
 */
public interface NotificationChannel {

    /**
     * Sends a notification through this channel.
     *
     * @param notification the reminder to deliver
     * @throws DeliveryException if the destination is not configured or rejects the delivery
     */
    void send(Notification notification);

    /**
     * Returns the name payloads use to select this channel.
     */
    String getName();
}
