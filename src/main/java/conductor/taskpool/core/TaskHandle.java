package conductor.taskpool.core;

import conductor.taskpool.error.TaskFailedException;
import conductor.taskpool.error.TaskNotFoundException;
import conductor.taskpool.model.TaskRecord;
import conductor.taskpool.model.TaskState;
import conductor.taskpool.repository.TaskRegistry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Caller-side reference to one submitted task.
 * Reads always go through the registry, so a handle reflects the live record
 * until the record is removed. A handle is bound to the record id: once its
 * record is evicted, a new task registered under the same name is not
 * visible through it.
 */
public final class TaskHandle {

    private final String name;
    private final String id;
    private final TaskRegistry registry;

    TaskHandle(TaskRecord record, TaskRegistry registry) {
        this.name = record.name();
        this.id = record.id();
        this.registry = Objects.requireNonNull(registry, "registry is required");
    }

    public String name() {
        return name;
    }

    /**
     * @throws TaskNotFoundException if the record was removed
     */
    public TaskRecord snapshot() {
        TaskRecord record = registry.get(name);
        if (!record.id().equals(id)) {
            throw new TaskNotFoundException(name);
        }
        return record;
    }

    public TaskState state() {
        return snapshot().state();
    }

    public boolean isDone() {
        return snapshot().isTerminal();
    }

    /**
     * Wait for the task to finish.
     *
     * @param timeout null waits without limit, zero only checks
     * @return true if the task is terminal
     * @throws TaskNotFoundException if the record was removed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        snapshot();
        boolean done = registry.awaitCompletion(name, timeout);
        return done && snapshot().isTerminal();
    }

    /**
     * Wait for the task and return its result.
     *
     * @throws TaskFailedException if the body raised
     */
    public Object get() throws InterruptedException {
        await(null);
        return outcome(snapshot());
    }

    /**
     * Like {@link #get()} but bounded.
     *
     * @throws TimeoutException if the task is still active
     */
    public Object get(Duration timeout) throws InterruptedException, TimeoutException {
        if (!await(timeout)) {
            throw new TimeoutException("Task " + name + " still active after " + timeout);
        }
        return outcome(snapshot());
    }

    private Object outcome(TaskRecord record) {
        if (record.state() == TaskState.FAILED) {
            throw new TaskFailedException(name, record.failure());
        }
        return record.result();
    }

    @Override
    public String toString() {
        return "TaskHandle{name='" + name + "', id=" + id + "}";
    }
}
