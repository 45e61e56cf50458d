package io.remindrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.ZoneId;

/**
 * Scheduler settings, bound to {@code remindrunr.scheduler}.
 *
 * @param timezone default IANA zone for definitions that do not name one
 * @param dataDir  directory holding the JSON stores
 */
@ConfigurationProperties(prefix = "remindrunr.scheduler")
public record SchedulerProperties(String timezone, Path dataDir) {

    public SchedulerProperties {
        if (timezone == null || timezone.isBlank()) {
            timezone = "Asia/Tokyo";
        }
        if (dataDir == null) {
            dataDir = Path.of("./data");
        }
    }

    public ZoneId zone() {
        return ZoneId.of(timezone);
    }
}
