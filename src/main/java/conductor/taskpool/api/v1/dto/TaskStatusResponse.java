package conductor.taskpool.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import conductor.taskpool.model.TaskRecord;

import java.time.Duration;
import java.time.Instant;

/**
 * Response DTO for one task's status.
 * Used in PoolReportResponse.tasks array.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskStatusResponse(
        @JsonProperty("name") String name,
        @JsonProperty("state") String state,
        @JsonProperty("priority") int priority,
        @JsonProperty("attempt") int attempt,
        @JsonProperty("retryOf") String retryOf,
        @JsonProperty("completedUnits") long completedUnits,
        @JsonProperty("totalUnits") long totalUnits,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt,
        @JsonProperty("runtimeMs") Long runtimeMs,
        @JsonProperty("result") String result,
        @JsonProperty("errorMessage") String errorMessage) {

    /**
     * Create response from domain model.
     * Results are rendered with {@code String.valueOf}; the failure is
     * rendered as its exception class and message.
     */
    public static TaskStatusResponse from(TaskRecord task) {
        Duration duration = task.duration();
        Long runtimeMs = task.isTerminal() && duration != null ? duration.toMillis() : null;
        String result = task.result() != null ? String.valueOf(task.result()) : null;
        String errorMessage = task.failure() != null ? task.failure().toString() : null;

        return new TaskStatusResponse(
                task.name(),
                task.state().name(),
                task.priority(),
                task.attempt(),
                task.retryOf(),
                task.completedUnits(),
                task.totalUnits(),
                task.createdAt(),
                task.startedAt(),
                task.finishedAt(),
                runtimeMs,
                result,
                errorMessage);
    }
}
