package io.remindrunr.prompt;

import io.remindrunr.security.InputSanitizer;
import io.remindrunr.store.ExecutionResultStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * REST API for prompt execution history and ad-hoc prompt runs.
 */
@RestController
@RequestMapping("/api/executions")
public class ExecutionController {

    private final ExecutionResultStore resultStore;
    private final PromptExecutor promptExecutor;
    private final InputSanitizer inputSanitizer;

    public ExecutionController(ExecutionResultStore resultStore, PromptExecutor promptExecutor,
                               InputSanitizer inputSanitizer) {
        this.resultStore = resultStore;
        this.promptExecutor = promptExecutor;
        this.inputSanitizer = inputSanitizer;
    }

    /**
     * Lists results, newest first. {@code search} matches prompt and response text.
     */
    @GetMapping
    public List<ExecutionResult> list(@RequestParam(required = false) String search,
                                      @RequestParam(required = false) String category,
                                      @RequestParam(required = false) String status,
                                      @RequestParam(defaultValue = "50") int limit) {
        String needle = search == null || search.isBlank() ? null : search.toLowerCase(Locale.ROOT);
        return resultStore.findAll().stream()
                .filter(r -> category == null || category.equals(r.category()))
                .filter(r -> status == null || status.isBlank() || status.equalsIgnoreCase(r.status().value()))
                .filter(r -> needle == null || contains(r.prompt(), needle) || contains(r.response(), needle))
                .limit(Math.max(0, limit))
                .toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<ExecutionResult> get(@PathVariable String id) {
        return resultStore.findById(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(@PathVariable String id) {
        if (!resultStore.delete(id)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Execution result not found"));
        }
        return ResponseEntity.ok(Map.of("message", "Execution result deleted successfully"));
    }

    @GetMapping("/meta/stats")
    public ExecutionStats stats() {
        return ExecutionStats.of(resultStore.findAll());
    }

    /**
     * Distinct categories of stored results, sorted.
     */
    @GetMapping("/meta/categories")
    public List<String> categories() {
        return resultStore.findAll().stream()
                .map(ExecutionResult::category)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * Distinct tags of stored results, sorted.
     */
    @GetMapping("/meta/tags")
    public List<String> tags() {
        return resultStore.findAll().stream()
                .flatMap(r -> r.tags().stream())
                .distinct()
                .sorted()
                .toList();
    }

    /**
     * Executes a prompt immediately. Failed executions are stored and answered with 502.
     */
    @PostMapping
    public ResponseEntity<?> execute(@RequestBody ExecuteRequest request) {
        String prompt = inputSanitizer.sanitize(request.prompt());
        if (prompt == null || prompt.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Prompt is required"));
        }
        ExecutionResult result = promptExecutor.execute(
                PromptExecutor.PromptRequest.manual(prompt, request.category(), request.tags()));
        HttpStatus status = result.isSuccess() ? HttpStatus.CREATED : HttpStatus.BAD_GATEWAY;
        return ResponseEntity.status(status).body(result);
    }

    private static boolean contains(String text, String needle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(needle);
    }

    public record ExecuteRequest(String prompt, String category, List<String> tags) {}
}
