package io.remindrunr.weather;

import io.remindrunr.schedule.WeatherPayload;
import io.remindrunr.store.WeatherSnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Polls every {@link WeatherSource} for a location and stores one snapshot per source.
 * A failing source is recorded as a failed snapshot and does not stop the others.
 */
@Service
public class WeatherPoller {

    private static final Logger log = LoggerFactory.getLogger(WeatherPoller.class);

    private final List<WeatherSource> sources;
    private final WeatherSnapshotStore store;
    private final Clock clock;

    public WeatherPoller(List<WeatherSource> sources, WeatherSnapshotStore store, Clock clock) {
        this.sources = List.copyOf(sources);
        this.store = store;
        this.clock = clock;
    }

    /**
     * @return the stored snapshots, one per source
     */
    public List<WeatherSnapshot> poll(String definitionId, WeatherPayload location) {
        List<WeatherSnapshot> snapshots = new ArrayList<>();
        for (WeatherSource source : sources) {
            WeatherSnapshot snapshot;
            try {
                snapshot = WeatherSnapshot.fetched(UUID.randomUUID().toString(), definitionId, source.getName(),
                        source.fetch(location.latitude(), location.longitude()), clock.instant());
            } catch (RuntimeException e) {
                log.warn("Weather source {} failed for '{}': {}", source.getName(), location.name(), e.getMessage());
                snapshot = WeatherSnapshot.failed(UUID.randomUUID().toString(), definitionId, source.getName(),
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), clock.instant());
            }
            snapshots.add(store.append(snapshot));
        }
        long succeeded = snapshots.stream().filter(WeatherSnapshot::success).count();
        log.info("Weather poll of '{}' ({}, {}) completed: {} success, {} errors", location.name(),
                location.latitude(), location.longitude(), succeeded, snapshots.size() - succeeded);
        return snapshots;
    }

    public List<WeatherSource> sources() {
        return sources;
    }
}
