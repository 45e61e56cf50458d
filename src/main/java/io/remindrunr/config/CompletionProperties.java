package io.remindrunr.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Prompt execution settings, bound to {@code remindrunr.completion}.
 *
 * @param timeout bound on a single completion call
 * @param model   model name recorded when the response does not report one
 */
@ConfigurationProperties(prefix = "remindrunr.completion")
public record CompletionProperties(Duration timeout, String model) {

    public CompletionProperties {
        if (timeout == null) {
            timeout = Duration.ofSeconds(30);
        }
        if (model == null || model.isBlank()) {
            model = "unknown";
        }
    }
}
