package io.remindrunr.prompt;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate figures over stored execution results.
 *
 * @param successRate percentage of successful executions, 0 when there are none
 */
public record ExecutionStats(
        int total,
        int successful,
        int failed,
        double successRate,
        long avgExecutionTimeMs,
        long totalTokens
) {

    public static ExecutionStats of(List<ExecutionResult> results) {
        int total = results.size();
        int successful = (int) results.stream().filter(ExecutionResult::isSuccess).count();
        double successRate = total == 0 ? 0 : Math.round(successful * 1000.0 / total) / 10.0;
        long avgTime = total == 0 ? 0 : Math.round(results.stream()
                .mapToLong(ExecutionResult::executionTimeMs)
                .average()
                .orElse(0));
        long tokens = results.stream()
                .map(ExecutionResult::tokensUsed)
                .filter(Objects::nonNull)
                .mapToLong(Integer::longValue)
                .sum();
        return new ExecutionStats(total, successful, total - successful, successRate, avgTime, tokens);
    }
}
