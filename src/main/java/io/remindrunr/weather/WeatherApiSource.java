package io.remindrunr.weather;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.remindrunr.config.WeatherProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Fetches a two-day forecast from WeatherAPI.com.
 *
 * <p>The raw response is kept as-is, with an added {@code hourlyTemperature} array holding up to
 * 24 hourly entries from one hour ago onward.</p>
 */
@Component
public class WeatherApiSource implements WeatherSource {

    private static final Logger log = LoggerFactory.getLogger(WeatherApiSource.class);
    static final String NAME = "weatherapi";
    static final int HOURS = 24;

    private final WeatherProperties properties;
    private final RestClient restClient;
    private final Clock clock;

    public WeatherApiSource(WeatherProperties properties, RestClient.Builder restClientBuilder, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.timeout())
                .build();
        var requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.timeout());
        this.restClient = restClientBuilder.requestFactory(requestFactory).build();
    }

    @Override
    public JsonNode fetch(double latitude, double longitude) {
        if (!isConfigured()) {
            throw new WeatherFetchException("WeatherAPI key not configured");
        }

        URI uri = UriComponentsBuilder.fromUriString(properties.baseUrl())
                .queryParam("key", properties.apiKey())
                .queryParam("q", latitude + "," + longitude)
                .queryParam("days", 2)
                .queryParam("aqi", "yes")
                .queryParam("alerts", "yes")
                .build().encode().toUri();
        JsonNode body;
        try {
            body = restClient.get().uri(uri).retrieve().body(JsonNode.class);
        } catch (RestClientResponseException e) {
            throw new WeatherFetchException("WeatherAPI returned HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new WeatherFetchException("WeatherAPI error: " + e.getMessage(), e);
        }
        if (!(body instanceof ObjectNode report)) {
            throw new WeatherFetchException("WeatherAPI returned no report");
        }

        report.set("hourlyTemperature", hourlyTemperature(report));
        log.debug("WeatherAPI report fetched for {},{}", latitude, longitude);
        return report;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.hasText(properties.apiKey());
    }

    private ArrayNode hourlyTemperature(ObjectNode report) {
        long now = clock.instant().getEpochSecond();
        long from = now - Duration.ofHours(1).toSeconds();
        long to = now + Duration.ofHours(HOURS).toSeconds();
        ArrayNode hourly = report.arrayNode();
        for (JsonNode day : report.path("forecast").path("forecastday")) {
            for (JsonNode hour : day.path("hour")) {
                long epoch = hour.path("time_epoch").asLong(Long.MIN_VALUE);
                if (epoch < from || epoch > to || hourly.size() >= HOURS) {
                    continue;
                }
                ObjectNode entry = hourly.addObject();
                entry.put("time", hour.path("time").asText());
                entry.set("temperature", hour.get("temp_c"));
                entry.put("condition", hour.path("condition").path("text").asText(null));
            }
        }
        return hourly;
    }
}
