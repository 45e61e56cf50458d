package io.remindrunr.prompt;

import io.remindrunr.config.CompletionProperties;
import io.remindrunr.store.ExecutionResultStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs prompts against the configured chat model and records every outcome.
 *
 * <p>Each call is bounded by {@code remindrunr.completion.timeout}. Errors are not
 * thrown: they come back as an {@link ExecutionStatus#ERROR} result, which is stored too.</p>
 */
@Service
public class PromptExecutor {

    private static final Logger log = LoggerFactory.getLogger(PromptExecutor.class);
    static final String NO_RESPONSE_TEXT = "";

    private final ChatModel chatModel;
    private final ExecutionResultStore resultStore;
    private final CompletionProperties properties;
    private final Clock clock;
    private final ExecutorService executor;

    @Autowired
    public PromptExecutor(@Autowired(required = false) ChatModel chatModel, ExecutionResultStore resultStore,
                          CompletionProperties properties, Clock clock) {
        this.chatModel = chatModel;
        this.resultStore = resultStore;
        this.properties = properties;
        this.clock = clock;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "completion-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        if (chatModel == null) {
            log.warn("No chat model configured. Prompt executions will fail");
        }
    }

    /**
     * Executes a prompt and stores the result.
     *
     * @param request what to run and how to label the result
     * @return the stored result, successful or not
     */
    public ExecutionResult execute(PromptRequest request) {
        Instant startedAt = clock.instant();
        log.info("Executing prompt '{}' ({})", abbreviate(request.prompt()), request.scheduledBy());

        if (chatModel == null) {
            return record(request, startedAt, null, "Completion model not configured");
        }

        Future<ChatResponse> future = executor.submit(() -> chatModel.call(new Prompt(request.prompt())));
        try {
            ChatResponse response = future.get(properties.timeout().toMillis(), TimeUnit.MILLISECONDS);
            return record(request, startedAt, response, null);
        } catch (TimeoutException e) {
            future.cancel(true);
            return record(request, startedAt, null,
                    "Completion timed out after " + properties.timeout().toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.debug("Completion call failed", cause);
            return record(request, startedAt, null, "Completion error: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return record(request, startedAt, null, "Completion interrupted");
        }
    }

    private ExecutionResult record(PromptRequest request, Instant startedAt, ChatResponse response, String error) {
        long elapsedMs = Math.max(0, clock.millis() - startedAt.toEpochMilli());
        ExecutionResult result;
        if (error != null) {
            result = new ExecutionResult(UUID.randomUUID().toString(), request.definitionId(), request.prompt(),
                    null, properties.model(), ExecutionStatus.ERROR, error, elapsedMs, null,
                    request.category(), request.tags(), request.scheduledBy(), clock.instant());
            log.warn("Prompt execution failed after {}ms: {}", elapsedMs, error);
        } else {
            result = new ExecutionResult(UUID.randomUUID().toString(), request.definitionId(), request.prompt(),
                    extractText(response), modelOf(response), ExecutionStatus.SUCCESS, null, elapsedMs,
                    totalTokens(response), request.category(), request.tags(), request.scheduledBy(), clock.instant());
            log.info("Prompt executed in {}ms ({} tokens)", elapsedMs, result.tokensUsed());
        }
        return resultStore.append(result);
    }

    private static String extractText(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return NO_RESPONSE_TEXT;
        }
        String text = response.getResult().getOutput().getText();
        return text == null ? NO_RESPONSE_TEXT : text;
    }

    private String modelOf(ChatResponse response) {
        ChatResponseMetadata metadata = response == null ? null : response.getMetadata();
        if (metadata == null || metadata.getModel() == null || metadata.getModel().isBlank()) {
            return properties.model();
        }
        return metadata.getModel();
    }

    private static Integer totalTokens(ChatResponse response) {
        ChatResponseMetadata metadata = response == null ? null : response.getMetadata();
        if (metadata == null) {
            return null;
        }
        Usage usage = metadata.getUsage();
        return usage == null ? null : usage.getTotalTokens();
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    /**
     * A prompt to execute.
     *
     * @param definitionId definition that fired, null for manual runs
     * @param scheduledBy  {@code scheduled}, {@code manual} or {@code test}
     */
    public record PromptRequest(String prompt, String category, List<String> tags,
                                String scheduledBy, String definitionId) {

        public static PromptRequest manual(String prompt, String category, List<String> tags) {
            return new PromptRequest(prompt, category == null ? "manual" : category, tags, "manual", null);
        }
    }
}
