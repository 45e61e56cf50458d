package io.remindrunr.channel;

import io.remindrunr.dispatch.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of notification channels by name.
 *
 * <p>Thread-safe: channels can be registered from any thread.</p>
 */
@Component
public class ChannelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

    private final Map<String, NotificationChannel> channels = new ConcurrentHashMap<>();

    public ChannelRegistry(List<NotificationChannel> channels) {
        channels.forEach(this::register);
    }

    public void register(NotificationChannel channel) {
        channels.put(channel.getName(), channel);
        log.info("Notification channel registered: {}", channel.getName());
    }

    /**
     * Returns a channel by name, if registered.
     */
    public Optional<NotificationChannel> getChannel(String name) {
        return Optional.ofNullable(name).map(channels::get);
    }

    public boolean hasChannel(String name) {
        return getChannel(name).isPresent();
    }

    /**
     * Returns all registered channel names, sorted.
     */
    public List<String> listChannels() {
        return channels.keySet().stream().sorted().toList();
    }

    /**
     * Sends a notification through the named channel.
     *
     * @throws DeliveryException if the channel is unknown or the delivery fails
     */
    public void deliver(String channelName, Notification notification) {
        NotificationChannel channel = getChannel(channelName)
                .orElseThrow(() -> new DeliveryException("Unknown notification method: " + channelName));
        log.debug("Routing notification {} to channel {}", notification.id(), channel.getName());
        channel.send(notification);
    }
}
