package conductor.taskpool.repository;

import conductor.taskpool.model.TaskRecord;
import conductor.taskpool.model.TaskState;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Thread-safe mapping from task name to its current {@link TaskRecord}.
 * The registry exclusively owns records; every read returns an immutable
 * snapshot and every operation is atomic with respect to the others.
 */
public interface TaskRegistry {

    /**
     * Register a record under its own name.
     *
     * @param record the record to save
     * @return the registered record
     * @throws conductor.taskpool.error.DuplicateTaskNameException if the name
     *                                                             is taken
     */
    TaskRecord register(TaskRecord record);

    /**
     * Register a record under the first free name among {@code baseName},
     * {@code baseName-2}, {@code baseName-3}, ...
     * Name choice and insertion happen atomically.
     *
     * @param baseName preferred name
     * @param factory  builds the record for the chosen name
     * @return the registered record
     */
    TaskRecord registerUnique(String baseName, Function<String, TaskRecord> factory);

    /**
     * Find a record by name.
     *
     * @param name the task name
     * @return the current snapshot if registered
     */
    Optional<TaskRecord> find(String name);

    /**
     * Get a record by name.
     *
     * @throws conductor.taskpool.error.TaskNotFoundException if unknown
     */
    TaskRecord get(String name);

    boolean contains(String name);

    /**
     * Atomically replace a record with {@code change.apply(current)}.
     * The state may stay the same or move forward; moving into a terminal
     * state fires the record's completion signal exactly once.
     *
     * @return the new snapshot
     * @throws conductor.taskpool.error.TaskNotFoundException if unknown
     * @throws IllegalStateException                          on a backwards
     *                                                        transition
     */
    TaskRecord transition(String name, UnaryOperator<TaskRecord> change);

    /**
     * Wait for one record to reach a terminal state.
     *
     * @param timeout null waits without limit, zero only checks
     * @return true if the record is terminal
     * @throws conductor.taskpool.error.TaskNotFoundException if unknown
     */
    boolean awaitCompletion(String name, Duration timeout) throws InterruptedException;

    /**
     * Wait until no record is RUNNING and, while {@code admissionOpen} holds,
     * none is PENDING either.
     *
     * @param admissionOpen re-evaluated on every wake-up
     * @param timeout       null waits without limit, zero only checks
     * @return names still PENDING or RUNNING when the wait ended
     */
    List<String> awaitDrained(BooleanSupplier admissionOpen, Duration timeout) throws InterruptedException;

    /** All records in registration order */
    List<TaskRecord> snapshot();

    List<TaskRecord> findByState(TaskState state);

    List<String> allNames();

    /** Names of RUNNING records */
    List<String> activeNames();

    /** Names of PENDING records */
    List<String> pendingNames();

    /**
     * Result of every record; null for records without one.
     */
    Map<String, Object> results();

    /**
     * Failure cause of every FAILED record.
     */
    Map<String, Throwable> failures();

    /**
     * Evict all terminal records.
     *
     * @return evicted names
     */
    List<String> removeFinished();

    int size();
}
