package io.remindrunr.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory map of definition id to its live timers.
 *
 * <p>Thread-safe. Replacing an entry is atomic per key: the previous timers are
 * cancelled inside the same {@code compute} call that installs the new ones.</p>
 */
@Component
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    private final Map<String, ActiveJob> jobs = new ConcurrentHashMap<>();

    /**
     * Installs the timers of a definition, cancelling whatever was installed before.
     * An empty list leaves no entry.
     */
    public void set(String definitionId, List<CancellableTimer> timers) {
        if (timers.isEmpty()) {
            cancel(definitionId);
            return;
        }
        ActiveJob replacement = new ActiveJob(definitionId, timers);
        jobs.compute(definitionId, (id, previous) -> {
            if (previous != null) {
                previous.cancelAll();
                log.debug("Replaced {} timer(s) of definition {}", previous.timers().size(), id);
            }
            return replacement;
        });
    }

    /**
     * Cancels and removes the timers of a definition. Unknown ids are ignored.
     *
     * @return true if an entry was removed
     */
    public boolean cancel(String definitionId) {
        ActiveJob removed = jobs.remove(definitionId);
        if (removed == null) {
            return false;
        }
        removed.cancelAll();
        log.debug("Cancelled {} timer(s) of definition {}", removed.timers().size(), definitionId);
        return true;
    }

    /**
     * Removes the entry without cancelling it, but only if it still holds the given timer.
     *
     * @return false if the timer was superseded or cancelled
     */
    public boolean release(String definitionId, String timerKey) {
        AtomicBoolean released = new AtomicBoolean(false);
        jobs.computeIfPresent(definitionId, (id, job) -> {
            if (job.owns(timerKey)) {
                released.set(true);
                return null;
            }
            return job;
        });
        return released.get();
    }

    public boolean owns(String definitionId, String timerKey) {
        ActiveJob job = jobs.get(definitionId);
        return job != null && job.owns(timerKey);
    }

    public Optional<ActiveJob> get(String definitionId) {
        return Optional.ofNullable(jobs.get(definitionId));
    }

    /**
     * Returns the ids of all definitions with live timers, sorted.
     */
    public List<String> list() {
        return jobs.keySet().stream().sorted().toList();
    }

    public List<ActiveJob> snapshot() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(ActiveJob::definitionId))
                .toList();
    }

    /**
     * Total number of live timers across all definitions.
     */
    public int timerCount() {
        return jobs.values().stream().mapToInt(job -> job.timers().size()).sum();
    }
}
