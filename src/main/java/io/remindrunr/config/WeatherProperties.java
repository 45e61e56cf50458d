package io.remindrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Weather polling settings, bound to {@code remindrunr.weather}.
 *
 * <pre>
 * remindrunr:
 *   weather:
 *     api-key: ${WEATHER_API_KEY:}
 *     base-url: http://api.weatherapi.com/v1/forecast.json
 *     timeout: 10s
 *     retention-days: 30
 *     cleanup-cron: "0 2 * * *"
 * </pre>
 *
 * @param apiKey        WeatherAPI.com key; blank leaves the source unconfigured
 * @param retentionDays snapshots older than this are removed by the daily cleanup
 * @param cleanupCron   5-field cron of the cleanup job, evaluated in the scheduler timezone
 */
@ConfigurationProperties(prefix = "remindrunr.weather")
public record WeatherProperties(String apiKey, String baseUrl, Duration timeout, Integer retentionDays,
                                String cleanupCron) {

    public WeatherProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "http://api.weatherapi.com/v1/forecast.json";
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(10);
        }
        if (retentionDays == null) {
            retentionDays = 30;
        }
        if (cleanupCron == null || cleanupCron.isBlank()) {
            cleanupCron = "0 2 * * *";
        }
    }
}
