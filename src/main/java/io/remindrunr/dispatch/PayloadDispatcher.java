package io.remindrunr.dispatch;

import io.remindrunr.channel.ChannelRegistry;
import io.remindrunr.channel.Notification;
import io.remindrunr.prompt.ExecutionResult;
import io.remindrunr.prompt.PromptExecutor;
import io.remindrunr.schedule.NotificationPayload;
import io.remindrunr.schedule.PromptPayload;
import io.remindrunr.schedule.ScheduleDefinition;
import io.remindrunr.schedule.WeatherPayload;
import io.remindrunr.weather.WeatherPoller;
import io.remindrunr.weather.WeatherSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Routes notification payloads to their channel, prompt payloads to the {@link PromptExecutor}
 * and weather payloads to the {@link WeatherPoller}.
 *
 * <p>A weather poll succeeds when at least one source returned data.</p>
 */
@Component
public class PayloadDispatcher implements Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(PayloadDispatcher.class);

    private final ChannelRegistry channelRegistry;
    private final PromptExecutor promptExecutor;
    private final WeatherPoller weatherPoller;

    public PayloadDispatcher(ChannelRegistry channelRegistry, PromptExecutor promptExecutor,
                             WeatherPoller weatherPoller) {
        this.channelRegistry = channelRegistry;
        this.promptExecutor = promptExecutor;
        this.weatherPoller = weatherPoller;
    }

    @Override
    public DispatchOutcome dispatch(ScheduleDefinition definition) {
        try {
            if (definition.payload() instanceof NotificationPayload notification) {
                channelRegistry.deliver(notification.channel(), Notification.from(definition, notification));
                return DispatchOutcome.success();
            }
            if (definition.payload() instanceof PromptPayload prompt) {
                ExecutionResult result = promptExecutor.execute(new PromptExecutor.PromptRequest(
                        prompt.prompt(), prompt.category(), prompt.tags(), "scheduled", definition.id()));
                return result.isSuccess() ? DispatchOutcome.success() : DispatchOutcome.failure(result.errorMessage());
            }
            if (definition.payload() instanceof WeatherPayload weather) {
                return weatherOutcome(weatherPoller.poll(definition.id(), weather));
            }
            return DispatchOutcome.failure("Unsupported payload: " + definition.payload().getClass().getSimpleName());
        } catch (DeliveryException e) {
            log.warn("Delivery of definition {} failed: {}", definition.id(), e.getMessage());
            return DispatchOutcome.failure(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error dispatching definition {}", definition.id(), e);
            return DispatchOutcome.failure(e.getMessage());
        }
    }

    private static DispatchOutcome weatherOutcome(List<WeatherSnapshot> snapshots) {
        if (snapshots.isEmpty()) {
            return DispatchOutcome.failure("No weather sources configured");
        }
        if (snapshots.stream().anyMatch(WeatherSnapshot::success)) {
            return DispatchOutcome.success();
        }
        return DispatchOutcome.failure(snapshots.stream()
                .map(s -> s.source() + ": " + s.error())
                .collect(Collectors.joining("; ")));
    }
}
