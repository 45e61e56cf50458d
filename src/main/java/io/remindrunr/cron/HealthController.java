package io.remindrunr.cron;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final JobRegistry registry;

    public HealthController(JobRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/api/health")
    public Map<String, Object> health() {
        return Map.of(
                "status", "ok",
                "service", "remindrunr",
                "activeJobs", registry.list().size()
        );
    }
}
