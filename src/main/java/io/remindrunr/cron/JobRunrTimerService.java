package io.remindrunr.cron;

import io.remindrunr.schedule.InvalidScheduleException;
import org.jobrunr.jobs.JobId;
import org.jobrunr.scheduling.JobScheduler;
import org.jobrunr.scheduling.cron.InvalidCronExpressionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * {@link TimerService} backed by JobRunr.
 *
 * <p>Fixed instants become scheduled jobs, cron expressions become recurring jobs.
 * Each timer gets a fresh key that is passed to the job, so a recurring job id is
 * never reused between an old and a replacement timer.</p>
 */
@Component
public class JobRunrTimerService implements TimerService {

    private static final Logger log = LoggerFactory.getLogger(JobRunrTimerService.class);
    static final String RECURRING_PREFIX = "schedule-";

    private final JobScheduler jobScheduler;
    private final Clock clock;

    public JobRunrTimerService(JobScheduler jobScheduler, Clock clock) {
        this.jobScheduler = jobScheduler;
        this.clock = clock;
    }

    @Override
    public CancellableTimer scheduleOnce(String definitionId, Instant fireAt) {
        String timerKey = newTimerKey();
        JobId jobId = jobScheduler.<ScheduleFiringJob>schedule(fireAt, job -> job.fireOnce(definitionId, timerKey));
        log.debug("Armed one-shot timer {} for definition {} at {}", jobId, definitionId, fireAt);

        return new JobRunrTimer(timerKey, () -> Optional.of(fireAt), () -> {
            jobScheduler.delete(jobId);
            log.debug("Deleted one-shot job {} of definition {}", jobId, definitionId);
        });
    }

    @Override
    public CancellableTimer scheduleCron(String definitionId, CronExpressionTrigger trigger) {
        String timerKey = newTimerKey();
        String recurringId = RECURRING_PREFIX + definitionId + "-" + timerKey;
        try {
            jobScheduler.<ScheduleFiringJob>scheduleRecurrently(recurringId, trigger.expression(), trigger.zone(),
                    job -> job.fireCron(definitionId, timerKey));
        } catch (InvalidCronExpressionException | IllegalArgumentException e) {
            throw new InvalidScheduleException(
                    "Cron expression \"%s\" rejected by scheduler: %s".formatted(trigger.expression(), e.getMessage()), e);
        }
        log.debug("Armed recurring timer {} ({}) for definition {}", recurringId, trigger, definitionId);

        return new JobRunrTimer(timerKey, () -> trigger.nextFireTime(clock.instant()), () -> {
            jobScheduler.deleteRecurringJob(recurringId);
            log.debug("Deleted recurring job {}", recurringId);
        });
    }

    private static String newTimerKey() {
        return UUID.randomUUID().toString();
    }

    private record JobRunrTimer(String key, Supplier<Optional<Instant>> next, Runnable onCancel)
            implements CancellableTimer {

        @Override
        public Optional<Instant> nextFireTime() {
            return next.get();
        }

        @Override
        public void cancel() {
            onCancel.run();
        }
    }
}
