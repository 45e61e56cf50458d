package io.remindrunr.cron;

import io.remindrunr.schedule.ScheduleDefinition;
import io.remindrunr.store.ScheduleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rebuilds live timers from the stored definitions once the application is ready.
 * Triggers missed while the process was down are not caught up.
 */
@Component
public class StartupRecovery {

    private static final Logger log = LoggerFactory.getLogger(StartupRecovery.class);

    private final ScheduleStore store;
    private final DefinitionScheduler scheduler;

    public StartupRecovery(ScheduleStore store, DefinitionScheduler scheduler) {
        this.store = store;
        this.scheduler = scheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        recover(store.findAll());
    }

    /**
     * Schedules pending one-shot and enabled cron definitions.
     * A definition that fails to schedule is logged and skipped.
     *
     * @return number of definitions that now have live timers
     */
    public int recover(List<ScheduleDefinition> definitions) {
        int scheduled = 0;
        int failed = 0;
        for (ScheduleDefinition definition : definitions) {
            if (!isRecoverable(definition)) {
                continue;
            }
            try {
                if (scheduler.schedule(definition)) {
                    scheduled++;
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to recover definition {} ('{}'): {}", definition.id(),
                        definition.payload().label(), e.getMessage(), e);
            }
        }
        log.info("Startup recovery scheduled {} of {} stored definition(s), {} failed",
                scheduled, definitions.size(), failed);
        return scheduled;
    }

    private static boolean isRecoverable(ScheduleDefinition definition) {
        return switch (definition.kind()) {
            case ONE_SHOT -> definition.isPending();
            case CRON_RECURRING -> definition.enabled();
        };
    }
}
