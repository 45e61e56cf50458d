package io.remindrunr.schedule;

import java.util.List;

/**
 * A text-completion prompt executed on each firing.
 *
 * @param name     display name of the scheduled prompt
 * @param prompt   prompt text sent to the completion model
 * @param category category recorded on each execution result
 * @param tags     tags recorded on each execution result
 */
public record PromptPayload(
        String name,
        String prompt,
        String category,
        List<String> tags
) implements Payload {

    public static final String DEFAULT_CATEGORY = "scheduled";

    public PromptPayload {
        if (name == null || name.isBlank()) {
            throw new InvalidScheduleException("Name is required and must be a non-empty string");
        }
        if (prompt == null || prompt.isBlank()) {
            throw new InvalidScheduleException("Prompt is required and must be a non-empty string");
        }
        name = name.trim();
        prompt = prompt.trim();
        if (category == null || category.isBlank()) {
            category = DEFAULT_CATEGORY;
        }
        if (tags == null) {
            tags = List.of();
        }
    }

    @Override
    public String label() {
        return name;
    }
}
