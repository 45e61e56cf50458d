package io.remindrunr.channel;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.remindrunr.config.NotificationProperties;
import io.remindrunr.dispatch.DeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.List;

/**
 * Posts reminders as JSON to the configured webhook URL.
 * Title and message are also appended as query parameters.
 */
@Component
public class WebhookChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(WebhookChannel.class);
    static final String NAME = "webhook";
    static final String USER_AGENT = "RemindRunr-Reminder";

    private final NotificationProperties.Webhook config;
    private final RestClient restClient;

    public WebhookChannel(NotificationProperties properties, RestClient.Builder restClientBuilder) {
        this.config = properties.webhook();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(config.timeout())
                .build();
        var requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(config.timeout());
        this.restClient = restClientBuilder.requestFactory(requestFactory).build();
    }

    @Override
    public void send(Notification notification) {
        if (!StringUtils.hasText(config.url())) {
            throw new DeliveryException("WEBHOOK_URL not configured");
        }

        URI uri = buildUri(config.url(), notification);
        ResponseEntity<Void> response;
        try {
            response = restClient.post()
                    .uri(uri)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.USER_AGENT, USER_AGENT)
                    .body(WebhookBody.from(notification))
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientResponseException e) {
            throw new DeliveryException("Webhook returned HTTP " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new DeliveryException("Webhook error: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new DeliveryException("Webhook returned HTTP " + response.getStatusCode().value());
        }
        log.info("Webhook sent ({}): {}", response.getStatusCode().value(), notification.title());
    }

    @Override
    public String getName() {
        return NAME;
    }

    static URI buildUri(String baseUrl, Notification notification) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl);
        if (StringUtils.hasText(notification.title())) {
            builder.queryParam("title", notification.title());
        }
        if (StringUtils.hasText(notification.message())) {
            builder.queryParam("message", notification.message());
        }
        return builder.build().encode().toUri();
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record WebhookBody(
            String id,
            String title,
            String message,
            String url,
            String notificationDateTime,
            String timezone,
            String category,
            List<String> tags
    ) {
        static WebhookBody from(Notification n) {
            return new WebhookBody(n.id(),
                    StringUtils.hasText(n.title()) ? n.title() : null,
                    StringUtils.hasText(n.message()) ? n.message() : null,
                    n.url(),
                    n.scheduledFor() == null ? null : n.scheduledFor().toString(),
                    n.timezone(), n.category(), n.tags());
        }
    }
}
