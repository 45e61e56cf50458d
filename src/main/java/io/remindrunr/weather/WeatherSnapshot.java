package io.remindrunr.weather;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Outcome of polling one source for one weather definition.
 *
 * @param data  raw report of the source, null on failure
 * @param error failure message, null on success
 */
public record WeatherSnapshot(
        String id,
        String definitionId,
        String source,
        JsonNode data,
        String error,
        boolean success,
        Instant fetchedAt
) {

    public static WeatherSnapshot fetched(String id, String definitionId, String source, JsonNode data,
                                          Instant fetchedAt) {
        return new WeatherSnapshot(id, definitionId, source, data, null, true, fetchedAt);
    }

    public static WeatherSnapshot failed(String id, String definitionId, String source, String error,
                                         Instant fetchedAt) {
        return new WeatherSnapshot(id, definitionId, source, null, error, false, fetchedAt);
    }
}
