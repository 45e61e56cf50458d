package io.remindrunr.prompt;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * Persisted outcome of one prompt execution.
 *
 * @param definitionId    definition that fired, null for manual runs
 * @param response        completion text, null on error
 * @param tokensUsed      total tokens reported by the model, if any
 * @param scheduledBy     {@code scheduled}, {@code manual} or {@code test}
 */
public record ExecutionResult(
        String id,
        String definitionId,
        String prompt,
        String response,
        String model,
        ExecutionStatus status,
        String errorMessage,
        long executionTimeMs,
        Integer tokensUsed,
        String category,
        List<String> tags,
        String scheduledBy,
        Instant createdAt
) {
    public ExecutionResult {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }
}
