package io.remindrunr.weather;

import io.remindrunr.cron.ScheduleService;
import io.remindrunr.schedule.WeatherPayload;
import io.remindrunr.store.WeatherSnapshotStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for stored weather snapshots. Locations themselves are weather definitions managed
 * under {@code /api/schedules}.
 */
@RestController
@RequestMapping("/api/weather")
public class WeatherController {

    private final WeatherSnapshotStore snapshotStore;
    private final WeatherPoller poller;
    private final WeatherCleanupJob cleanupJob;
    private final ScheduleService scheduleService;

    public WeatherController(WeatherSnapshotStore snapshotStore, WeatherPoller poller,
                             WeatherCleanupJob cleanupJob, ScheduleService scheduleService) {
        this.snapshotStore = snapshotStore;
        this.poller = poller;
        this.cleanupJob = cleanupJob;
        this.scheduleService = scheduleService;
    }

    /**
     * Snapshots of a weather definition, newest first, optionally limited to one source.
     */
    @GetMapping("/{definitionId}")
    public ResponseEntity<List<WeatherSnapshot>> history(@PathVariable String definitionId,
                                                         @RequestParam(required = false) String source,
                                                         @RequestParam(defaultValue = "50") int limit) {
        if (!isWeatherDefinition(definitionId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(snapshotStore.findByDefinition(definitionId).stream()
                .filter(s -> source == null || source.equals(s.source()))
                .limit(Math.max(0, limit))
                .toList());
    }

    /**
     * Newest snapshot per source.
     */
    @GetMapping("/{definitionId}/latest")
    public ResponseEntity<Map<String, WeatherSnapshot>> latest(@PathVariable String definitionId) {
        if (!isWeatherDefinition(definitionId)) {
            return ResponseEntity.notFound().build();
        }
        Map<String, WeatherSnapshot> latest = new LinkedHashMap<>();
        snapshotStore.findByDefinition(definitionId).forEach(s -> latest.putIfAbsent(s.source(), s));
        return ResponseEntity.ok(latest);
    }

    @PostMapping("/cleanup")
    public Map<String, Integer> cleanup(@RequestParam(defaultValue = "30") int days) {
        return Map.of("deletedRecords", cleanupJob.deleteOlderThan(Math.max(0, days)));
    }

    @GetMapping("/sources")
    public List<Map<String, Object>> sources() {
        return poller.sources().stream()
                .map(s -> Map.<String, Object>of("name", s.getName(), "configured", s.isConfigured()))
                .toList();
    }

    private boolean isWeatherDefinition(String definitionId) {
        return scheduleService.getDefinition(definitionId)
                .filter(d -> d.payload() instanceof WeatherPayload)
                .isPresent();
    }
}
