package io.remindrunr.schedule;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.List;

/**
 * Persisted description of when a definition fires.
 *
 * <p>Stored as a tagged variant so the engine never has to guess whether a value
 * holds one cron expression or several:</p>
 * <pre>
 * {"type": "at",        "at": "2025-01-06T00:00:00Z"}
 * {"type": "cron",      "expression": "0 9 * * *"}
 * {"type": "cron-list", "expressions": ["0 9 * * *", "0 18 * * *"]}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TriggerSpec.At.class, name = "at"),
        @JsonSubTypes.Type(value = TriggerSpec.SingleCron.class, name = "cron"),
        @JsonSubTypes.Type(value = TriggerSpec.MultipleCron.class, name = "cron-list")
})
public interface TriggerSpec {

    /**
     * Returns the cron expressions of this trigger, empty for a fixed instant.
     */
    List<String> cronExpressions();

    static TriggerSpec at(Instant instant) {
        return new At(instant);
    }

    static TriggerSpec single(String expression) {
        return new SingleCron(expression);
    }

    static TriggerSpec multiple(List<String> expressions) {
        return new MultipleCron(expressions);
    }

    record At(Instant at) implements TriggerSpec {
        public At {
            if (at == null) {
                throw new InvalidScheduleException("Notification date time is required");
            }
        }

        @Override
        public List<String> cronExpressions() {
            return List.of();
        }
    }

    record SingleCron(String expression) implements TriggerSpec {
        public SingleCron {
            if (expression == null || expression.isBlank()) {
                throw new InvalidScheduleException("Cron expression is required");
            }
            expression = expression.trim();
        }

        @Override
        public List<String> cronExpressions() {
            return List.of(expression);
        }
    }

    record MultipleCron(List<String> expressions) implements TriggerSpec {
        public MultipleCron {
            if (expressions == null || expressions.isEmpty()) {
                throw new InvalidScheduleException("Cron expression array must be non-empty");
            }
            for (String expression : expressions) {
                if (expression == null || expression.isBlank()) {
                    throw new InvalidScheduleException("Each cron expression must be a non-empty string");
                }
            }
            expressions = expressions.stream().map(String::trim).toList();
        }

        @Override
        public List<String> cronExpressions() {
            return expressions;
        }
    }
}
