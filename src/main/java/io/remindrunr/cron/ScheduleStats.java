package io.remindrunr.cron;

import java.util.Map;

/**
 * Counts over stored definitions and live timers.
 *
 * @param byChannel  notification definitions per channel name
 * @param activeJobs definitions that currently have live timers
 * @param liveTimers total live timers
 */
public record ScheduleStats(
        int total,
        int pending,
        int sent,
        int cronEnabled,
        int cronDisabled,
        Map<String, Long> byChannel,
        int activeJobs,
        int liveTimers
) {}
