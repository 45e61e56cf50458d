package io.remindrunr.store;

import io.remindrunr.schedule.ScheduleDefinition;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable storage for schedule definitions.
 *
 * <p>Implementations must apply {@link #update} atomically: the change function
 * sees the latest stored record and its result replaces that record as a whole.</p>
 */
public interface ScheduleStore {

    List<ScheduleDefinition> findAll();

    Optional<ScheduleDefinition> findById(String id);

    /**
     * Inserts the definition, or replaces the stored one with the same id.
     */
    ScheduleDefinition save(ScheduleDefinition definition);

    /**
     * Applies {@code change} to the stored record and persists the result.
     * Nothing is written if the change function throws.
     *
     * @return the updated record, or empty if no record has this id
     */
    Optional<ScheduleDefinition> update(String id, UnaryOperator<ScheduleDefinition> change);

    boolean delete(String id);
}
