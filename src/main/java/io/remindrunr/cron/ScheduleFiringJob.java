package io.remindrunr.cron;

import org.jobrunr.jobs.annotations.Job;
import org.springframework.stereotype.Component;

/**
 * JobRunr entry point for timer firings. Resolved from the Spring context when a job runs.
 */
@Component
public class ScheduleFiringJob {

    private final DefinitionScheduler scheduler;

    public ScheduleFiringJob(DefinitionScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Job(name = "Fire one-shot definition %0", retries = 0)
    public void fireOnce(String definitionId, String timerKey) {
        scheduler.fireOnce(definitionId, timerKey);
    }

    @Job(name = "Fire cron definition %0", retries = 0)
    public void fireCron(String definitionId, String timerKey) {
        scheduler.fireCron(definitionId, timerKey);
    }
}
