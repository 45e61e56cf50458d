package io.remindrunr.schedule;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Action data carried by a definition and executed on each firing.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = NotificationPayload.class, name = "notification"),
        @JsonSubTypes.Type(value = PromptPayload.class, name = "prompt"),
        @JsonSubTypes.Type(value = WeatherPayload.class, name = "weather")
})
public interface Payload {

    /**
     * Short human-readable label used in logs.
     */
    String label();

    String category();

    List<String> tags();
}
