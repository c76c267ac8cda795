package conductor.taskpool.core;

import conductor.taskpool.api.v1.dto.PoolReportResponse;
import conductor.taskpool.config.PoolConfig;
import conductor.taskpool.error.TaskFailedException;
import conductor.taskpool.model.TaskBody;
import conductor.taskpool.model.TaskRecord;
import conductor.taskpool.model.TaskRequest;
import conductor.taskpool.model.TaskState;
import conductor.taskpool.model.TaskStatus;
import conductor.taskpool.observer.TaskObserver;
import conductor.taskpool.queue.AdmissionQueue;
import conductor.taskpool.repository.InMemoryTaskRegistry;
import conductor.taskpool.repository.TaskRegistry;
import conductor.taskpool.scheduler.RetryCoordinator;
import conductor.taskpool.scheduler.WorkerPoolController;
import conductor.taskpool.service.TaskNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Bounded-concurrency, priority-ordered task pool.
 *
 * <p>Creates and wires the registry, admission queue, worker controller and
 * retry coordinator. Usage:
 *
 * <pre>
 * try (TaskPool pool = TaskPool.create(PoolConfig.defaults().withMaxWorkers(3))) {
 *     pool.submit(TaskRequest.builder().name("load").body(ctx -> load()).priority(1).build());
 *     pool.run();              // open admission and wait for the drain
 *     pool.retryFailed();      // resubmit failures
 *     pool.join();
 * }
 * </pre>
 *
 * Submissions only register work; nothing runs until {@link #startAll()} or
 * {@link #run()} opens admission. Tasks submitted after that are admitted as
 * soon as a slot is free.
 */
public final class TaskPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskPool.class);

    private final PoolConfig config;
    private final TaskRegistry registry;
    private final AdmissionQueue queue;
    private final CancellationToken cancellation;
    private final WorkerPoolController controller;
    private final RetryCoordinator retryCoordinator;

    private volatile boolean closed = false;

    private TaskPool(PoolConfig config, TaskObserver observer, CancellationToken cancellation) {
        this.config = Objects.requireNonNull(config, "config is required").validate();

        this.registry = new InMemoryTaskRegistry(config.pollInterval());
        this.queue = new AdmissionQueue();
        this.cancellation = cancellation;
        this.controller = new WorkerPoolController(registry, queue, cancellation,
                observer != null ? observer : TaskObserver.NOOP, config);
        this.retryCoordinator = new RetryCoordinator(registry, controller);

        log.info("Task pool created with config: {}", config);
    }

    /**
     * @throws conductor.taskpool.error.ConfigurationException if the config is invalid
     */
    public static TaskPool create(PoolConfig config) {
        return new TaskPool(config, TaskObserver.NOOP, new CancellationToken());
    }

    public static TaskPool create(PoolConfig config, TaskObserver observer) {
        return new TaskPool(config, observer, new CancellationToken());
    }

    /**
     * Create a pool that shares an externally owned cancellation token.
     */
    public static TaskPool create(PoolConfig config, TaskObserver observer, CancellationToken cancellation) {
        return new TaskPool(config, observer, Objects.requireNonNull(cancellation, "cancellation is required"));
    }

    /**
     * Create a pool with environment-based config.
     */
    public static TaskPool create() {
        return create(PoolConfig.fromEnv());
    }

    // ---- Submission ----

    /**
     * Register a task as PENDING and queue it for admission.
     * An explicit name must be free; an omitted one is derived from the body
     * and made unique with a numeric suffix.
     *
     * @throws conductor.taskpool.error.DuplicateTaskNameException if the
     *                                                             explicit
     *                                                             name is taken
     */
    public TaskHandle submit(TaskRequest request) {
        Objects.requireNonNull(request, "request is required");
        Function<String, TaskRecord> factory = name -> TaskRecord.builder()
                .id(TaskNames.newId())
                .name(name)
                .body(request.body())
                .args(request.args())
                .priority(request.priority())
                .totalUnits(request.totalUnits())
                .createdAt(Instant.now())
                .build();

        TaskRecord record = request.hasName()
                ? registry.register(factory.apply(request.name()))
                : registry.registerUnique(TaskNames.deriveBaseName(request.body()), factory);

        controller.enqueue(record.name(), record.priority());
        return new TaskHandle(record, registry);
    }

    public TaskHandle submit(String name, TaskBody body) {
        return submit(TaskRequest.of(name, body));
    }

    public TaskHandle submit(String name, int priority, TaskBody body) {
        return submit(TaskRequest.builder().name(name).priority(priority).body(body).build());
    }

    public TaskHandle submit(TaskBody body) {
        return submit(TaskRequest.of(body));
    }

    /**
     * Handle for an already registered task.
     *
     * @throws conductor.taskpool.error.TaskNotFoundException if unknown
     */
    public TaskHandle handle(String name) {
        return new TaskHandle(registry.get(name), registry);
    }

    // ---- Running ----

    /**
     * Open admission. A no-op once cancellation is set.
     *
     * @return names admitted immediately
     */
    public List<String> startAll() {
        return controller.open();
    }

    /**
     * Open admission and wait until everything has drained.
     *
     * @return names still active (only non-empty after cancellation)
     */
    public List<String> run() {
        startAll();
        return join();
    }

    /**
     * Open admission and wait at most {@code timeout}.
     *
     * @return names still PENDING or RUNNING when the wait ended
     */
    public List<String> run(Duration timeout) {
        startAll();
        return join(timeout);
    }

    /**
     * Wait without limit for the pool to drain.
     */
    public List<String> join() {
        return join(null);
    }

    /**
     * Wait until no task is RUNNING and, while admission is open, none is
     * PENDING, or until the timeout elapses. Running out of time is not an
     * error; the still-active names are returned.
     *
     * @param timeout null waits without limit, {@link Duration#ZERO} only checks
     * @return names still PENDING or RUNNING
     */
    public List<String> join(Duration timeout) {
        try {
            return registry.awaitDrained(controller::isAdmissionOpen, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return activeOrPendingNames();
        }
    }

    /**
     * Wait for one task.
     *
     * @return true if it finished
     * @throws conductor.taskpool.error.TaskNotFoundException if unknown
     */
    public boolean joinTask(String name, Duration timeout) {
        try {
            return registry.awaitCompletion(name, timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return registry.get(name).isTerminal();
        }
    }

    /**
     * Resubmit every task that is FAILED right now.
     * New records are admitted as soon as admission is open.
     *
     * @return names of the new records
     */
    public List<String> retryFailed() {
        return retryCoordinator.retryFailed();
    }

    /**
     * Set the cooperative cancellation signal. Running bodies may observe it
     * through their context; queued tasks are no longer admitted.
     */
    public void cancel() {
        if (cancellation.cancel()) {
            log.info("Cancellation requested ({} running, {} queued)",
                    controller.runningCount(), controller.queuedCount());
        }
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public CancellationToken cancellationToken() {
        return cancellation;
    }

    // ---- Queries ----

    /**
     * @throws conductor.taskpool.error.TaskNotFoundException if unknown
     */
    public TaskRecord record(String name) {
        return registry.get(name);
    }

    /**
     * @throws conductor.taskpool.error.TaskNotFoundException if unknown
     */
    public TaskStatus status(String name) {
        return TaskStatus.from(registry.get(name));
    }

    /**
     * Result of one task.
     *
     * @param rethrow when true a failed task raises {@link TaskFailedException}
     * @return the result, or null if none was produced
     * @throws conductor.taskpool.error.TaskNotFoundException if unknown
     */
    public Object result(String name, boolean rethrow) {
        TaskRecord record = registry.get(name);
        if (rethrow && record.state() == TaskState.FAILED) {
            throw new TaskFailedException(name, record.failure());
        }
        return record.result();
    }

    /** Name to result for every record; null where there is none */
    public Map<String, Object> results() {
        return registry.results();
    }

    /**
     * Like {@link #results()} but raises for the first failed record.
     */
    public Map<String, Object> results(boolean rethrow) {
        if (rethrow) {
            failures(true);
        }
        return registry.results();
    }

    /** Name to failure cause for every FAILED record */
    public Map<String, Throwable> failures() {
        return registry.failures();
    }

    /**
     * @param rethrow when true and any record failed, raises
     *                {@link TaskFailedException} for the first one
     */
    public Map<String, Throwable> failures(boolean rethrow) {
        Map<String, Throwable> failures = registry.failures();
        if (rethrow && !failures.isEmpty()) {
            Map.Entry<String, Throwable> first = failures.entrySet().iterator().next();
            throw new TaskFailedException(first.getKey(), first.getValue());
        }
        return failures;
    }

    public List<String> allNames() {
        return registry.allNames();
    }

    /** Names of RUNNING tasks */
    public List<String> activeNames() {
        return registry.activeNames();
    }

    public List<String> pendingNames() {
        return registry.pendingNames();
    }

    /** Names waiting for admission, in the order they would be admitted */
    public List<String> queuedNames() {
        return queue.snapshot();
    }

    private List<String> activeOrPendingNames() {
        List<String> names = new ArrayList<>();
        for (TaskRecord record : registry.snapshot()) {
            if (!record.isTerminal()) {
                names.add(record.name());
            }
        }
        return names;
    }

    /**
     * True when no record is PENDING or RUNNING.
     */
    public boolean isAllDone() {
        return activeOrPendingNames().isEmpty();
    }

    /**
     * Evict all terminal records.
     *
     * @return evicted names
     */
    public List<String> removeFinished() {
        List<String> removed = registry.removeFinished();
        retryCoordinator.prune();
        return removed;
    }

    public int runningCount() {
        return controller.runningCount();
    }

    public int peakRunningCount() {
        return controller.peakRunningCount();
    }

    public PoolConfig config() {
        return config;
    }

    /**
     * Status of every record, ready for JSON rendering.
     */
    public PoolReportResponse report() {
        return PoolReportResponse.from(registry.snapshot(), controller.maxWorkers(),
                controller.runningCount(), controller.queuedCount(), cancellation.isCancelled());
    }

    /**
     * Cancel, give running tasks up to {@code closeTimeout} to finish, then
     * release the worker threads.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("Closing task pool...");

        cancel();
        join(config.closeTimeout());
        List<String> stillRunning = registry.activeNames();
        if (!stillRunning.isEmpty()) {
            log.warn("Tasks still running on close: {}", stillRunning);
        }
        List<String> neverStarted = queue.snapshot();
        if (!neverStarted.isEmpty()) {
            log.info("{} queued tasks never started: {}", neverStarted.size(), neverStarted);
        }
        controller.shutdown(config.closeTimeout());

        log.info("Task pool closed");
    }
}
