package conductor.taskpool.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import conductor.taskpool.model.TaskRecord;
import conductor.taskpool.model.TaskState;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a whole-pool status report.
 */
public record PoolReportResponse(
        @JsonProperty("maxWorkers") int maxWorkers,
        @JsonProperty("running") int running,
        @JsonProperty("queued") int queued,
        @JsonProperty("cancelled") boolean cancelled,
        @JsonProperty("counts") Map<TaskState, Integer> counts,
        @JsonProperty("tasks") List<TaskStatusResponse> tasks) {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .findAndRegisterModules();

    public static PoolReportResponse from(List<TaskRecord> records, int maxWorkers, int running, int queued,
            boolean cancelled) {
        Map<TaskState, Integer> counts = new EnumMap<>(TaskState.class);
        for (TaskState state : TaskState.values()) {
            counts.put(state, 0);
        }
        List<TaskStatusResponse> tasks = new ArrayList<>(records.size());
        for (TaskRecord record : records) {
            counts.merge(record.state(), 1, Integer::sum);
            tasks.add(TaskStatusResponse.from(record));
        }
        return new PoolReportResponse(maxWorkers, running, queued, cancelled, counts, tasks);
    }

    /**
     * Render as pretty-printed JSON.
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render pool report", e);
        }
    }
}
