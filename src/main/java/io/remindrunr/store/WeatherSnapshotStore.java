package io.remindrunr.store;

import io.remindrunr.weather.WeatherSnapshot;

import java.time.Instant;
import java.util.List;

/**
 * Durable storage for weather snapshots.
 */
public interface WeatherSnapshotStore {

    WeatherSnapshot append(WeatherSnapshot snapshot);

    /**
     * Returns the snapshots of a definition, newest first.
     */
    List<WeatherSnapshot> findByDefinition(String definitionId);

    /**
     * @return number of snapshots removed
     */
    int deleteOlderThan(Instant cutoff);

    /**
     * @return number of snapshots removed
     */
    int deleteByDefinition(String definitionId);
}
