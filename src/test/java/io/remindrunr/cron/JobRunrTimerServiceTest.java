package io.remindrunr.cron;

import org.jobrunr.jobs.RecurringJob;
import org.jobrunr.jobs.mappers.JobMapper;
import org.jobrunr.scheduling.JobScheduler;
import org.jobrunr.storage.InMemoryStorageProvider;
import org.jobrunr.storage.StorageProvider;
import org.jobrunr.utils.mapper.jackson.JacksonJsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Uses a real JobScheduler over InMemoryStorageProvider so that job lambdas are
 * actually analysed and stored, not just passed to a mock.
 */
class JobRunrTimerServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private StorageProvider storageProvider;
    private JobRunrTimerService timerService;

    @BeforeEach
    void setUp() {
        InMemoryStorageProvider inMemory = new InMemoryStorageProvider();
        inMemory.setJobMapper(new JobMapper(new JacksonJsonMapper()));
        storageProvider = inMemory;
        timerService = new JobRunrTimerService(new JobScheduler(storageProvider), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void cronTimerShouldCreateRecurringJob() {
        var trigger = new CronExpressionTrigger("0 9 * * *", ZoneId.of("Asia/Tokyo"));

        CancellableTimer timer = timerService.scheduleCron("def-1", trigger);

        List<RecurringJob> jobs = storageProvider.getRecurringJobs();
        assertEquals(1, jobs.size());
        RecurringJob job = jobs.get(0);
        assertEquals(JobRunrTimerService.RECURRING_PREFIX + "def-1-" + timer.key(), job.getId());
        assertEquals("0 9 * * *", job.getScheduleExpression());
        assertEquals("Asia/Tokyo", job.getZoneId());
    }

    @Test
    void cronJobShouldCarryDefinitionIdAndTimerKey() {
        CancellableTimer timer = timerService.scheduleCron("def-1",
                new CronExpressionTrigger("0 9 * * *", ZoneOffset.UTC));

        Object[] params = storageProvider.getRecurringJobs().get(0).getJobDetails().getJobParameterValues();

        assertArrayEquals(new Object[]{"def-1", timer.key()}, params);
    }

    @Test
    void cronTimerShouldReportNextFireTime() {
        CancellableTimer timer = timerService.scheduleCron("def-1",
                new CronExpressionTrigger("0 9 * * *", ZoneOffset.UTC));

        assertEquals(Instant.parse("2025-01-01T09:00:00Z"), timer.nextFireTime().orElseThrow());
    }

    @Test
    void cancellingCronTimerShouldDeleteRecurringJob() {
        CancellableTimer first = timerService.scheduleCron("def-1", new CronExpressionTrigger("0 9 * * *", ZoneOffset.UTC));
        timerService.scheduleCron("def-1", new CronExpressionTrigger("0 18 * * *", ZoneOffset.UTC));

        first.cancel();

        List<RecurringJob> jobs = storageProvider.getRecurringJobs();
        assertEquals(1, jobs.size());
        assertEquals("0 18 * * *", jobs.get(0).getScheduleExpression());
    }

    @Test
    void oneShotTimerShouldScheduleAndDeleteJob() {
        var fireAt = Instant.now().plus(Duration.ofDays(7));

        CancellableTimer timer = timerService.scheduleOnce("def-1", fireAt);

        assertEquals(fireAt, timer.nextFireTime().orElseThrow());
        assertEquals(1L, storageProvider.getJobStats().getScheduled());

        timer.cancel();

        assertEquals(0L, storageProvider.getJobStats().getScheduled());
    }
}
