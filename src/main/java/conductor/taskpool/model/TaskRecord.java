package conductor.taskpool.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one unit of work and its run-state.
 * The registry replaces the snapshot on every transition, so a reader never
 * observes a record half way through a state change.
 */
public final class TaskRecord {
    private final String id;
    private final String name;
    private final String rootName; // name of the first attempt
    private final TaskBody body;
    private final List<Object> args;
    private final int priority;
    private final TaskState state;
    private final Object result;
    private final Throwable failure;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final long completedUnits;
    private final long totalUnits;
    private final int attempt;
    private final String retryOf;

    private TaskRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.rootName = builder.rootName != null ? builder.rootName : builder.name;
        this.body = Objects.requireNonNull(builder.body, "body is required");
        this.args = builder.args != null
                ? Collections.unmodifiableList(new ArrayList<>(builder.args))
                : List.of();
        this.priority = builder.priority;
        this.state = Objects.requireNonNull(builder.state, "state is required");
        this.result = builder.result;
        this.failure = builder.failure;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.completedUnits = builder.completedUnits;
        this.totalUnits = builder.totalUnits;
        this.attempt = builder.attempt;
        this.retryOf = builder.retryOf;
        checkInvariants();
    }

    private void checkInvariants() {
        if (!state.isTerminal() && (result != null || failure != null)) {
            throw new IllegalStateException("Task " + name + " is " + state + " but carries an outcome");
        }
        if (result != null && failure != null) {
            throw new IllegalStateException("Task " + name + " has both a result and a failure");
        }
        if (state == TaskState.FAILED && failure == null) {
            throw new IllegalStateException("Task " + name + " is FAILED without a cause");
        }
        if (state == TaskState.PENDING && (startedAt != null || finishedAt != null)) {
            throw new IllegalStateException("Task " + name + " is PENDING but has timestamps");
        }
        if (state.isTerminal() != (finishedAt != null)) {
            throw new IllegalStateException("Task " + name + " finishedAt does not match state " + state);
        }
        if (totalUnits <= 0 || completedUnits < 0 || completedUnits > totalUnits) {
            throw new IllegalStateException("Task " + name + " progress out of range: "
                    + completedUnits + "/" + totalUnits);
        }
    }

    // Getters
    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String rootName() {
        return rootName;
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

    public TaskState state() {
        return state;
    }

    public Object result() {
        return result;
    }

    public Throwable failure() {
        return failure;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public long completedUnits() {
        return completedUnits;
    }

    public long totalUnits() {
        return totalUnits;
    }

    public int attempt() {
        return attempt;
    }

    public String retryOf() {
        return retryOf;
    }

    /** Check if task is in terminal state */
    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Wall-clock time spent running; null while PENDING.
     * For a RUNNING task this is the time elapsed so far.
     */
    public Duration duration() {
        if (startedAt == null) {
            return null;
        }
        Instant end = finishedAt != null ? finishedAt : Instant.now();
        return Duration.between(startedAt, end);
    }

    /** Create a builder from this record (for transitions) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .rootName(rootName)
                .body(body)
                .args(args)
                .priority(priority)
                .state(state)
                .result(result)
                .failure(failure)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .completedUnits(completedUnits)
                .totalUnits(totalUnits)
                .attempt(attempt)
                .retryOf(retryOf);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String rootName;
        private TaskBody body;
        private List<Object> args;
        private int priority = 0;
        private TaskState state = TaskState.PENDING;
        private Object result;
        private Throwable failure;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;
        private long completedUnits = 0;
        private long totalUnits = TaskRequest.DEFAULT_TOTAL_UNITS;
        private int attempt = 1;
        private String retryOf;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder rootName(String rootName) {
            this.rootName = rootName;
            return this;
        }

        public Builder body(TaskBody body) {
            this.body = body;
            return this;
        }

        public Builder args(List<Object> args) {
            this.args = args;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder state(TaskState state) {
            this.state = state;
            return this;
        }

        public Builder result(Object result) {
            this.result = result;
            return this;
        }

        public Builder failure(Throwable failure) {
            this.failure = failure;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder completedUnits(long completedUnits) {
            this.completedUnits = completedUnits;
            return this;
        }

        public Builder totalUnits(long totalUnits) {
            this.totalUnits = totalUnits;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder retryOf(String retryOf) {
            this.retryOf = retryOf;
            return this;
        }

        public TaskRecord build() {
            return new TaskRecord(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskRecord record))
            return false;
        return Objects.equals(id, record.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TaskRecord{name='" + name + "', state=" + state + ", priority=" + priority
                + ", attempt=" + attempt + "}";
    }
}
