package io.remindrunr.store;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A JSON file holding an array of records.
 *
 * <p>All access is synchronized on this instance. Writes go to a sibling temp file
 * which then replaces the original, so readers never see a half-written array.</p>
 */
class JsonArrayFile<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonArrayFile.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final JavaType listType;

    JsonArrayFile(Path file, ObjectMapper objectMapper, Class<T> elementType) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.listType = objectMapper.getTypeFactory().constructCollectionType(List.class, elementType);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create data directory for " + file, e);
        }
    }

    synchronized List<T> read() {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            List<T> items = objectMapper.readValue(file.toFile(), listType);
            return items == null ? new ArrayList<>() : new ArrayList<>(items);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    /**
     * Reads the array, lets {@code change} mutate it, then writes it back.
     * Nothing is written if {@code change} throws.
     */
    synchronized <R> R modify(Function<List<T>, R> change) {
        List<T> items = read();
        R result = change.apply(items);
        write(items);
        return result;
    }

    private void write(List<T> items) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), items);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    Path path() {
        return file;
    }
}
