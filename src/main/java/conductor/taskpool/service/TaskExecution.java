package conductor.taskpool.service;

import conductor.taskpool.core.CancellationToken;
import conductor.taskpool.model.TaskContext;
import conductor.taskpool.model.TaskRecord;
import conductor.taskpool.model.TaskState;
import conductor.taskpool.observer.TaskObserver;
import conductor.taskpool.repository.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

/**
 * Supervises one admitted task on a worker thread. The controller has already
 * moved the record to RUNNING; this class then:
 * 1. invokes the body once
 * 2. records the result or the failure cause
 * 3. stamps finishedAt, which fires the record's completion signal
 *
 * Nothing thrown by the body or the observer escapes this class, and a record
 * never stays RUNNING after {@link #run()} returns. {@code onFinished} is
 * always called, after the terminal transition, so the caller can free the slot.
 */
public final class TaskExecution implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskExecution.class);

    private final String name;
    private final TaskRegistry registry;
    private final TaskObserver observer;
    private final CancellationToken cancellation;
    private final String threadNamePrefix;
    private final Consumer<String> onFinished;

    public TaskExecution(String name,
            TaskRegistry registry,
            TaskObserver observer,
            CancellationToken cancellation,
            String threadNamePrefix,
            Consumer<String> onFinished) {
        this.name = name;
        this.registry = registry;
        this.observer = observer;
        this.cancellation = cancellation;
        this.threadNamePrefix = threadNamePrefix;
        this.onFinished = onFinished;
    }

    public String name() {
        return name;
    }

    @Override
    public void run() {
        Thread thread = Thread.currentThread();
        String previousName = thread.getName();
        thread.setName(threadNamePrefix + "-" + name);
        try {
            execute();
        } catch (Throwable e) {
            log.error("Task {} could not be supervised", name, e);
            failIfRunning(e);
        } finally {
            thread.setName(previousName);
            onFinished.accept(name);
        }
    }

    private void execute() {
        TaskRecord running = registry.get(name);
        if (running.state() != TaskState.RUNNING) {
            log.warn("Task {} is {}, not RUNNING; body not invoked", name, running.state());
            return;
        }
        notifyObserver(() -> observer.onAdmitted(name, 0, running.totalUnits()));
        log.debug("Task {} started (priority {}, attempt {})", name, running.priority(), running.attempt());

        Object result = null;
        Throwable failure = null;
        try {
            result = running.body().run(new Context(running));
        } catch (Throwable e) {
            failure = e;
            log.error("Task {} raised: {}", name, e.toString(), e);
        }

        TaskRecord finished = finish(result, failure);
        log.debug("Task {} finished {} in {}ms", name, finished.state(), finished.duration().toMillis());
        notifyObserver(() -> observer.onCompleted(name, finished.state(),
                finished.completedUnits(), finished.totalUnits()));
    }

    // last resort so waiters on the completion signal are always released
    private void failIfRunning(Throwable cause) {
        try {
            registry.transition(name, r -> r.state() != TaskState.RUNNING ? r : r.toBuilder()
                    .state(TaskState.FAILED)
                    .failure(cause)
                    .finishedAt(Instant.now())
                    .build());
        } catch (RuntimeException e) {
            log.error("Task {} could not be marked FAILED", name, e);
        }
    }

    private TaskRecord finish(Object result, Throwable failure) {
        Instant now = Instant.now();
        if (failure == null) {
            return registry.transition(name, r -> r.toBuilder()
                    .state(TaskState.SUCCEEDED)
                    .result(result)
                    .completedUnits(r.totalUnits())
                    .finishedAt(now)
                    .build());
        }
        return registry.transition(name, r -> r.toBuilder()
                .state(TaskState.FAILED)
                .failure(failure)
                .finishedAt(now)
                .build());
    }

    private void notifyObserver(Runnable call) {
        try {
            call.run();
        } catch (Throwable e) {
            log.error("Observer failed for task {}", name, e);
        }
    }

    private final class Context implements TaskContext {
        private final TaskRecord record;
        private long reported;

        Context(TaskRecord record) {
            this.record = record;
        }

        @Override
        public String name() {
            return record.name();
        }

        @Override
        public List<Object> args() {
            return record.args();
        }

        @Override
        public long totalUnits() {
            return record.totalUnits();
        }

        @Override
        public synchronized void reportProgress(long completedUnits) {
            long clamped = Math.max(0, Math.min(completedUnits, record.totalUnits()));
            if (clamped <= reported) {
                return;
            }
            reported = clamped;
            // late reports from a leaked context are dropped once the record is terminal
            registry.transition(name, r -> r.isTerminal() ? r : r.toBuilder().completedUnits(clamped).build());
            notifyObserver(() -> observer.onProgress(name, clamped, record.totalUnits()));
        }

        @Override
        public boolean isCancelled() {
            return cancellation.isCancelled();
        }
    }
}
