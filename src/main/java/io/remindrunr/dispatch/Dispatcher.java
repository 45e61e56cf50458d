package io.remindrunr.dispatch;

import io.remindrunr.schedule.ScheduleDefinition;

/**
 * Executes the action of a definition once per firing.
 */
public interface Dispatcher {

    /**
     * Performs the side effect described by the definition's payload.
     * Never throws for delivery problems; those are reported in the outcome.
     */
    DispatchOutcome dispatch(ScheduleDefinition definition);
}
