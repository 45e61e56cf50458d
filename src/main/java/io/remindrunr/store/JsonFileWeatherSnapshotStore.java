package io.remindrunr.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.remindrunr.config.SchedulerProperties;
import io.remindrunr.weather.WeatherSnapshot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Stores weather snapshots in {@code weather-data.json} under the data directory.
 */
@Repository
public class JsonFileWeatherSnapshotStore implements WeatherSnapshotStore {

    static final String FILE_NAME = "weather-data.json";

    private final JsonArrayFile<WeatherSnapshot> file;

    @Autowired
    public JsonFileWeatherSnapshotStore(SchedulerProperties properties, ObjectMapper objectMapper) {
        this(properties.dataDir().resolve(FILE_NAME), objectMapper);
    }

    JsonFileWeatherSnapshotStore(Path path, ObjectMapper objectMapper) {
        this.file = new JsonArrayFile<>(path, objectMapper, WeatherSnapshot.class);
    }

    @Override
    public WeatherSnapshot append(WeatherSnapshot snapshot) {
        return file.modify(items -> {
            items.add(snapshot);
            return snapshot;
        });
    }

    @Override
    public List<WeatherSnapshot> findByDefinition(String definitionId) {
        return file.read().stream()
                .filter(s -> definitionId.equals(s.definitionId()))
                .sorted(Comparator.comparing(WeatherSnapshot::fetchedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        return removeWhere(s -> s.fetchedAt() == null || s.fetchedAt().isBefore(cutoff));
    }

    @Override
    public int deleteByDefinition(String definitionId) {
        return removeWhere(s -> definitionId.equals(s.definitionId()));
    }

    private int removeWhere(Predicate<WeatherSnapshot> condition) {
        return file.modify(items -> {
            int before = items.size();
            items.removeIf(condition);
            return before - items.size();
        });
    }
}
