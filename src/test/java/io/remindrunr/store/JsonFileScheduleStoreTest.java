package io.remindrunr.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.remindrunr.schedule.DeliveryStatus;
import io.remindrunr.schedule.NotificationPayload;
import io.remindrunr.schedule.PromptPayload;
import io.remindrunr.schedule.Recurrence;
import io.remindrunr.schedule.RecurrenceInterval;
import io.remindrunr.schedule.ScheduleDefinition;
import io.remindrunr.schedule.TriggerSpec;
import io.remindrunr.schedule.WeatherPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileScheduleStoreTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private Path file;
    private JsonFileScheduleStore store;

    @BeforeEach
    void setUp() {
        objectMapper = JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
        file = tempDir.resolve("data").resolve(JsonFileScheduleStore.FILE_NAME);
        store = new JsonFileScheduleStore(file, objectMapper);
    }

    @Test
    void shouldStartEmptyWithoutFile() {
        assertTrue(store.findAll().isEmpty());
        assertTrue(store.findById("missing").isEmpty());
    }

    @Test
    void shouldPersistAcrossInstances() {
        store.save(oneShot("r1"));
        store.save(cron("c1"));

        var reopened = new JsonFileScheduleStore(file, objectMapper);

        assertEquals(2, reopened.findAll().size());
        assertEquals(oneShot("r1"), reopened.findById("r1").orElseThrow());
        assertEquals(cron("c1"), reopened.findById("c1").orElseThrow());
    }

    @Test
    void shouldWriteTaggedVariants() throws Exception {
        store.save(cron("c1"));

        var json = objectMapper.readTree(file.toFile()).get(0);
        assertEquals("cron-list", json.get("trigger").get("type").asText());
        assertEquals("prompt", json.get("payload").get("type").asText());
        assertEquals("cron-recurring", json.get("kind").asText());
    }

    @Test
    void shouldPersistWeatherPayload() throws Exception {
        var weather = ScheduleDefinition.cronRecurring("w1", TriggerSpec.single(WeatherPayload.DEFAULT_CRON),
                new WeatherPayload("Tokyo", 35.68, 139.77, null, List.of("city")), true, "UTC", NOW);
        store.save(weather);

        assertEquals("weather", objectMapper.readTree(file.toFile()).get(0).get("payload").get("type").asText());
        assertEquals(weather, new JsonFileScheduleStore(file, objectMapper).findById("w1").orElseThrow());
    }

    @Test
    void shouldReplaceOnSaveWithSameId() {
        store.save(oneShot("r1"));
        store.save(oneShot("r1").markSent(NOW));

        assertEquals(1, store.findAll().size());
        assertEquals(DeliveryStatus.SENT, store.findById("r1").orElseThrow().status());
    }

    @Test
    void shouldUpdateAtomically() {
        store.save(oneShot("r1"));

        var updated = store.update("r1", d -> d.markFailed("boom", NOW));

        assertEquals("boom", updated.orElseThrow().lastError());
        assertEquals("boom", new JsonFileScheduleStore(file, objectMapper).findById("r1").orElseThrow().lastError());
    }

    @Test
    void shouldReturnEmptyWhenUpdatingMissing() {
        assertTrue(store.update("missing", d -> d.markSent(NOW)).isEmpty());
    }

    @Test
    void shouldLeaveFileUntouchedWhenChangeThrows() throws Exception {
        store.save(oneShot("r1"));
        String before = Files.readString(file);

        assertThrows(IllegalStateException.class, () -> store.update("r1", d -> {
            throw new IllegalStateException("rejected");
        }));

        assertEquals(before, Files.readString(file));
    }

    @Test
    void shouldDelete() {
        store.save(oneShot("r1"));

        assertTrue(store.delete("r1"));
        assertFalse(store.delete("r1"));
        assertTrue(store.findAll().isEmpty());
    }

    @Test
    void shouldNotLeaveTempFileBehind() throws Exception {
        store.save(oneShot("r1"));

        try (var files = Files.list(file.getParent())) {
            assertEquals(List.of(file), files.toList());
        }
    }

    @Test
    void shouldFailOnCorruptFile() throws Exception {
        Files.writeString(file, "{not json");

        assertThrows(UncheckedIOException.class, () -> store.findAll());
    }

    private static ScheduleDefinition oneShot(String id) {
        var payload = new NotificationPayload("Dentist", "Bring card", null, "email", "health", List.of("personal"));
        return ScheduleDefinition.oneShot(id, Instant.parse("2025-01-06T00:00:00Z"), payload,
                Recurrence.of(RecurrenceInterval.MONTHLY, null, 12), "Asia/Tokyo", NOW);
    }

    private static ScheduleDefinition cron(String id) {
        var payload = new PromptPayload("Digest", "Summarize today's news", null, List.of("daily"));
        return ScheduleDefinition.cronRecurring(id, TriggerSpec.multiple(List.of("0 9 * * *", "0 18 * * *")),
                payload, true, "UTC", NOW);
    }
}
