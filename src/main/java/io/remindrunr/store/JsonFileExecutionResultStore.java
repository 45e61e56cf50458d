package io.remindrunr.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.remindrunr.config.SchedulerProperties;
import io.remindrunr.prompt.ExecutionResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Stores execution results in {@code execution-results.json} under the data directory.
 */
@Repository
public class JsonFileExecutionResultStore implements ExecutionResultStore {

    static final String FILE_NAME = "execution-results.json";

    private final JsonArrayFile<ExecutionResult> file;

    @Autowired
    public JsonFileExecutionResultStore(SchedulerProperties properties, ObjectMapper objectMapper) {
        this(properties.dataDir().resolve(FILE_NAME), objectMapper);
    }

    JsonFileExecutionResultStore(Path path, ObjectMapper objectMapper) {
        this.file = new JsonArrayFile<>(path, objectMapper, ExecutionResult.class);
    }

    @Override
    public ExecutionResult append(ExecutionResult result) {
        return file.modify(items -> {
            items.add(result);
            return result;
        });
    }

    @Override
    public List<ExecutionResult> findAll() {
        return file.read().stream()
                .sorted(Comparator.comparing(ExecutionResult::createdAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    @Override
    public Optional<ExecutionResult> findById(String id) {
        return file.read().stream().filter(r -> r.id().equals(id)).findFirst();
    }

    @Override
    public boolean delete(String id) {
        return file.modify(items -> items.removeIf(r -> r.id().equals(id)));
    }
}
