package conductor.taskpool.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Submission request for a single task.
 * A null name means "derive one from the body".
 */
public final class TaskRequest {

    public static final long DEFAULT_TOTAL_UNITS = 100;

    private final String name;
    private final TaskBody body;
    private final List<Object> args;
    private final int priority;
    private final long totalUnits;

    private TaskRequest(Builder builder) {
        this.body = Objects.requireNonNull(builder.body, "body is required");
        if (builder.name != null && builder.name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (builder.totalUnits <= 0) {
            throw new IllegalArgumentException("totalUnits must be positive");
        }
        this.name = builder.name;
        this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
        this.priority = builder.priority;
        this.totalUnits = builder.totalUnits;
    }

    public static TaskRequest of(TaskBody body) {
        return builder().body(body).build();
    }

    public static TaskRequest of(String name, TaskBody body) {
        return builder().name(name).body(body).build();
    }

    public String name() {
        return name;
    }

    public boolean hasName() {
        return name != null;
    }

    public TaskBody body() {
        return body;
    }

    public List<Object> args() {
        return args;
    }

    public int priority() {
        return priority;
    }

    public long totalUnits() {
        return totalUnits;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private TaskBody body;
        private final List<Object> args = new ArrayList<>();
        private int priority = 0;
        private long totalUnits = DEFAULT_TOTAL_UNITS;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder body(TaskBody body) {
            this.body = body;
            return this;
        }

        public Builder args(Object... args) {
            this.args.clear();
            this.args.addAll(Arrays.asList(args));
            return this;
        }

        public Builder args(List<?> args) {
            this.args.clear();
            this.args.addAll(args);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder totalUnits(long totalUnits) {
            this.totalUnits = totalUnits;
            return this;
        }

        public TaskRequest build() {
            return new TaskRequest(this);
        }
    }

    @Override
    public String toString() {
        return "TaskRequest{name='" + name + "', priority=" + priority + ", args=" + args.size() + "}";
    }
}
