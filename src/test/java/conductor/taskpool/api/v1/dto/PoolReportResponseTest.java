package conductor.taskpool.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import conductor.taskpool.model.TaskRecord;
import conductor.taskpool.model.TaskState;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PoolReportResponseTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private static TaskRecord.Builder base(String name) {
        return TaskRecord.builder()
                .id("id-" + name)
                .name(name)
                .body(ctx -> null)
                .createdAt(T0);
    }

    @Test
    void countsEveryStateIncludingEmptyOnes() {
        List<TaskRecord> records = List.of(
                base("waiting").build(),
                base("done").state(TaskState.SUCCEEDED).result(7)
                        .startedAt(T0).finishedAt(T0.plusMillis(1500)).build());

        PoolReportResponse report = PoolReportResponse.from(records, 3, 0, 1, false);

        assertEquals(1, report.counts().get(TaskState.PENDING));
        assertEquals(0, report.counts().get(TaskState.RUNNING));
        assertEquals(1, report.counts().get(TaskState.SUCCEEDED));
        assertEquals(0, report.counts().get(TaskState.FAILED));
        assertEquals(2, report.tasks().size());
    }

    @Test
    void rendersJsonWithIsoDatesAndWithoutNulls() throws Exception {
        TaskRecord failed = base("broken")
                .priority(2)
                .state(TaskState.FAILED)
                .failure(new IllegalStateException("disk full"))
                .startedAt(T0)
                .finishedAt(T0.plusMillis(250))
                .build();

        String json = PoolReportResponse.from(List.of(failed), 2, 0, 0, true).toJson();
        JsonNode root = new ObjectMapper().readTree(json);

        assertEquals(2, root.get("maxWorkers").asInt());
        assertTrue(root.get("cancelled").asBoolean());
        assertEquals(1, root.get("counts").get("FAILED").asInt());
        JsonNode task = root.get("tasks").get(0);
        assertEquals("broken", task.get("name").asText());
        assertEquals("FAILED", task.get("state").asText());
        assertEquals("2024-03-01T10:00:00Z", task.get("startedAt").asText());
        assertEquals(250, task.get("runtimeMs").asLong());
        assertEquals("java.lang.IllegalStateException: disk full", task.get("errorMessage").asText());
        assertFalse(task.has("result"));
        assertFalse(task.has("retryOf"));
    }

    @Test
    void pendingTaskHasNoRuntime() {
        TaskStatusResponse response = TaskStatusResponse.from(base("later").build());

        assertEquals("PENDING", response.state());
        assertNull(response.runtimeMs());
        assertNull(response.startedAt());
        assertEquals(1, response.attempt());
    }
}
