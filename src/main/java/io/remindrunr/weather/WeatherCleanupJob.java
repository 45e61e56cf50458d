package io.remindrunr.weather;

import io.remindrunr.config.SchedulerProperties;
import io.remindrunr.config.WeatherProperties;
import io.remindrunr.store.WeatherSnapshotStore;
import org.jobrunr.jobs.annotations.Job;
import org.jobrunr.scheduling.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Removes weather snapshots past their retention. Runs as a JobRunr recurring job registered
 * once the application is ready.
 */
@Component
public class WeatherCleanupJob {

    private static final Logger log = LoggerFactory.getLogger(WeatherCleanupJob.class);
    static final String RECURRING_ID = "weather-data-cleanup";

    private final JobScheduler jobScheduler;
    private final WeatherSnapshotStore store;
    private final WeatherProperties properties;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    public WeatherCleanupJob(JobScheduler jobScheduler, WeatherSnapshotStore store, WeatherProperties properties,
                             SchedulerProperties schedulerProperties, Clock clock) {
        this.jobScheduler = jobScheduler;
        this.store = store;
        this.properties = properties;
        this.schedulerProperties = schedulerProperties;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        jobScheduler.<WeatherCleanupJob>scheduleRecurrently(RECURRING_ID, properties.cleanupCron(),
                schedulerProperties.zone(), job -> job.cleanup());
        log.info("Scheduled weather data cleanup ({} {}), retention {} days", properties.cleanupCron(),
                schedulerProperties.zone(), properties.retentionDays());
    }

    @Job(name = "Weather data cleanup", retries = 0)
    public void cleanup() {
        deleteOlderThan(properties.retentionDays());
    }

    /**
     * Deletes snapshots fetched more than {@code days} days ago.
     *
     * @return number of snapshots removed
     */
    public int deleteOlderThan(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        int deleted = store.deleteOlderThan(cutoff);
        log.info("Weather data cleanup removed {} snapshot(s) older than {}", deleted, cutoff);
        return deleted;
    }
}
