package io.remindrunr.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Delivery state of a one-shot definition.
 */
public enum DeliveryStatus {
    PENDING("pending"),
    SENT("sent");

    private final String value;

    DeliveryStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DeliveryStatus fromValue(String value) {
        for (DeliveryStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new InvalidScheduleException("Status must be one of: pending, sent");
    }
}
