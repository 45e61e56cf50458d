package io.remindrunr.weather;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A weather API polled for a location.
 */
public interface WeatherSource {

    /**
     * Fetches the current report for a location.
     *
     * @throws WeatherFetchException if the source is unconfigured or the call fails
     */
    JsonNode fetch(double latitude, double longitude);

    /**
     * Returns the source name recorded on each snapshot.
     */
    String getName();

    boolean isConfigured();
}
