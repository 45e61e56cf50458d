package io.remindrunr.schedule;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the legacy {@code cronExpression} request value into a {@link TriggerSpec}.
 *
 * <p>Older clients send either a single expression ({@code "0 9 * * *"}) or a
 * JSON array encoded as a string ({@code "[\"0 9 * * *\",\"0 18 * * *\"]"}).
 * The value is converted once at the request boundary.</p>
 */
public final class CronValues {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CronValues() {
    }

    public static TriggerSpec toTrigger(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidScheduleException("Cron expression is required");
        }
        String value = raw.trim();
        if (!(value.startsWith("[") && value.endsWith("]"))) {
            return TriggerSpec.single(value);
        }

        JsonNode node;
        try {
            node = MAPPER.readTree(value);
        } catch (JsonProcessingException e) {
            throw new InvalidScheduleException("Invalid JSON format for cron expression array", e);
        }
        if (!node.isArray() || node.isEmpty()) {
            throw new InvalidScheduleException("Cron expression array must be non-empty");
        }

        List<String> expressions = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new InvalidScheduleException("Each cron expression must be a string");
            }
            expressions.add(element.asText());
        }
        return expressions.size() == 1 ? TriggerSpec.single(expressions.get(0)) : TriggerSpec.multiple(expressions);
    }
}
