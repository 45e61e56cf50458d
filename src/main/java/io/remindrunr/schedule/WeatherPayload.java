package io.remindrunr.schedule;

import java.util.List;

/**
 * Polls the configured weather sources for a location on each firing.
 *
 * @param name      display name of the location
 * @param latitude  decimal degrees, -90 to 90
 * @param longitude decimal degrees, -180 to 180
 */
public record WeatherPayload(
        String name,
        Double latitude,
        Double longitude,
        String category,
        List<String> tags
) implements Payload {

    public static final String DEFAULT_CATEGORY = "weather";
    /**
     * Hourly, on the hour.
     */
    public static final String DEFAULT_CRON = "0 * * * *";

    public WeatherPayload {
        if (name == null || name.isBlank()) {
            throw new InvalidScheduleException("Location name is required");
        }
        if (latitude == null || longitude == null) {
            throw new InvalidScheduleException("Latitude and longitude are required");
        }
        if (latitude.isNaN() || latitude < -90 || latitude > 90) {
            throw new InvalidScheduleException("Latitude must be between -90 and 90");
        }
        if (longitude.isNaN() || longitude < -180 || longitude > 180) {
            throw new InvalidScheduleException("Longitude must be between -180 and 180");
        }
        name = name.trim();
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
