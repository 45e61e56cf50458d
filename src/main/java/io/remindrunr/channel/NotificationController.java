package io.remindrunr.channel;

import io.remindrunr.dispatch.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Sends test notifications so channel configuration can be checked without scheduling anything.
 */
@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private static final Logger log = LoggerFactory.getLogger(NotificationController.class);

    private final ChannelRegistry channelRegistry;
    private final Clock clock;

    public NotificationController(ChannelRegistry channelRegistry, Clock clock) {
        this.channelRegistry = channelRegistry;
        this.clock = clock;
    }

    @PostMapping("/test/{channel}")
    public ResponseEntity<Map<String, Object>> test(@PathVariable String channel) {
        if (!channelRegistry.hasChannel(channel)) {
            return ResponseEntity.badRequest().body(Map.of("error",
                    "Invalid notification method. Must be one of: " + String.join(", ", channelRegistry.listChannels())));
        }

        Notification notification = new Notification("test-" + UUID.randomUUID(), "Test notification",
                "This is a test notification from RemindRunr.", null, clock.instant(), "UTC", "test", List.of("test"));
        try {
            channelRegistry.deliver(channel, notification);
            return ResponseEntity.ok(Map.of("success", true,
                    "message", "Test %s notification sent successfully".formatted(channel)));
        } catch (DeliveryException e) {
            log.warn("Test {} notification failed: {}", channel, e.getMessage());
            return ResponseEntity.ok(Map.of("success", false,
                    "message", "Failed to send test %s notification: %s".formatted(channel, e.getMessage())));
        }
    }
}
