package io.remindrunr.cron;

import io.remindrunr.dispatch.DispatchOutcome;
import io.remindrunr.schedule.ScheduleDefinition;
import io.remindrunr.security.InputSanitizer;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for schedule definitions.
 * Covers one-shot reminders and cron-recurring definitions.
 */
@RestController
@RequestMapping("/api/schedules")
public class ScheduleController {

    private final ScheduleService scheduleService;
    private final InputSanitizer inputSanitizer;

    public ScheduleController(ScheduleService scheduleService, InputSanitizer inputSanitizer) {
        this.scheduleService = scheduleService;
        this.inputSanitizer = inputSanitizer;
    }

    @GetMapping
    public List<ScheduleDefinition> list(@RequestParam(required = false) String kind,
                                         @RequestParam(required = false) String status,
                                         @RequestParam(required = false) String channel,
                                         @RequestParam(required = false) String category,
                                         @RequestParam(required = false) Integer upcoming) {
        return scheduleService.listDefinitions(new ScheduleFilter(kind, status, channel, category, upcoming));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ScheduleDefinition> get(@PathVariable String id) {
        return scheduleService.getDefinition(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Creates a definition and schedules it.
     */
    @PostMapping
    public ResponseEntity<ScheduleDefinition> create(@RequestBody ScheduleRequest request) {
        ScheduleDefinition created = scheduleService.createDefinition(sanitize(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    /**
     * Updates the given fields of a definition.
     */
    @PutMapping("/{id}")
    public ResponseEntity<ScheduleDefinition> update(@PathVariable String id, @RequestBody ScheduleRequest request) {
        return scheduleService.updateDefinition(id, sanitize(request))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String id) {
        if (!scheduleService.deleteDefinition(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("status", "removed", "id", id));
    }

    /**
     * Dispatches a definition immediately.
     */
    @PostMapping("/{id}/run")
    public ResponseEntity<Map<String, Object>> run(@PathVariable String id) {
        return scheduleService.runNow(id)
                .map(outcome -> ResponseEntity.ok(runResponse(id, outcome)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Lists definitions with live timers.
     */
    @GetMapping("/jobs")
    public Map<String, Object> jobs() {
        List<JobView> jobs = scheduleService.activeJobs().stream().map(JobView::of).toList();
        return Map.of("jobs", jobs, "count", jobs.size());
    }

    @GetMapping("/meta/stats")
    public ScheduleStats stats() {
        return scheduleService.stats();
    }

    @GetMapping("/meta/categories")
    public List<String> categories() {
        return scheduleService.listCategories();
    }

    @GetMapping("/meta/tags")
    public List<String> tags() {
        return scheduleService.listTags();
    }

    private ScheduleRequest sanitize(ScheduleRequest r) {
        return new ScheduleRequest(r.kind(), r.at(), r.cron(), r.cronExpressions(), r.enabled(), r.status(),
                r.recurrence(), r.timezone(),
                inputSanitizer.sanitizeTitle(r.title()),
                inputSanitizer.sanitize(r.message()),
                r.url(), r.channel(),
                inputSanitizer.sanitizeTitle(r.name()),
                inputSanitizer.sanitize(r.prompt()),
                r.category(), r.tags(), r.latitude(), r.longitude());
    }

    private static Map<String, Object> runResponse(String id, DispatchOutcome outcome) {
        Map<String, Object> body = new HashMap<>();
        body.put("id", id);
        body.put("status", outcome.succeeded() ? "dispatched" : "failed");
        if (!outcome.succeeded()) {
            body.put("error", outcome.error());
        }
        return body;
    }

    public record JobView(String definitionId, Instant nextFireTime, List<TimerView> timers) {

        static JobView of(ActiveJob job) {
            List<TimerView> timers = job.timers().stream()
                    .map(timer -> new TimerView(timer.key(), timer.nextFireTime().orElse(null)))
                    .toList();
            return new JobView(job.definitionId(), job.nextFireTime().orElse(null), timers);
        }
    }

    public record TimerView(String key, Instant nextFireTime) {}
}
