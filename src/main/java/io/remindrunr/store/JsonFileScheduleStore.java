package io.remindrunr.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.remindrunr.config.SchedulerProperties;
import io.remindrunr.schedule.ScheduleDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Stores definitions in {@code schedules.json} under the data directory.
 */
@Repository
public class JsonFileScheduleStore implements ScheduleStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileScheduleStore.class);
    static final String FILE_NAME = "schedules.json";

    private final JsonArrayFile<ScheduleDefinition> file;

    @Autowired
    public JsonFileScheduleStore(SchedulerProperties properties, ObjectMapper objectMapper) {
        this(properties.dataDir().resolve(FILE_NAME), objectMapper);
    }

    JsonFileScheduleStore(Path path, ObjectMapper objectMapper) {
        this.file = new JsonArrayFile<>(path, objectMapper, ScheduleDefinition.class);
        log.info("Schedule store: {}", path.toAbsolutePath());
    }

    @Override
    public List<ScheduleDefinition> findAll() {
        return List.copyOf(file.read());
    }

    @Override
    public Optional<ScheduleDefinition> findById(String id) {
        return file.read().stream().filter(d -> d.id().equals(id)).findFirst();
    }

    @Override
    public ScheduleDefinition save(ScheduleDefinition definition) {
        return file.modify(items -> {
            int index = indexOf(items, definition.id());
            if (index >= 0) {
                items.set(index, definition);
            } else {
                items.add(definition);
            }
            return definition;
        });
    }

    @Override
    public Optional<ScheduleDefinition> update(String id, UnaryOperator<ScheduleDefinition> change) {
        return file.modify(items -> {
            int index = indexOf(items, id);
            if (index < 0) {
                return Optional.empty();
            }
            ScheduleDefinition updated = change.apply(items.get(index));
            items.set(index, updated);
            return Optional.of(updated);
        });
    }

    @Override
    public boolean delete(String id) {
        return file.modify(items -> items.removeIf(d -> d.id().equals(id)));
    }

    private static int indexOf(List<ScheduleDefinition> items, String id) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }
}
