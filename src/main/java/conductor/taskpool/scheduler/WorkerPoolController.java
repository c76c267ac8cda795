package conductor.taskpool.scheduler;

import conductor.taskpool.config.PoolConfig;
import conductor.taskpool.core.CancellationToken;
import conductor.taskpool.error.ConfigurationException;
import conductor.taskpool.model.TaskRecord;
import conductor.taskpool.model.TaskState;
import conductor.taskpool.observer.TaskObserver;
import conductor.taskpool.queue.AdmissionQueue;
import conductor.taskpool.repository.TaskRegistry;
import conductor.taskpool.service.TaskExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enforces the concurrency cap and admits queued tasks in priority order.
 *
 * <p>Admission is event driven: a dispatch pass runs whenever a task is
 * enqueued, the gate is opened, or a running task frees its slot. Each pass
 * pops names while {@code running < maxWorkers}, so nothing spins while the
 * queue is empty or every slot is taken.
 *
 * <p>Nothing is admitted until {@link #open()} is called, and nothing more is
 * admitted once the cancellation token is set.
 */
public class WorkerPoolController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolController.class);

    private final TaskRegistry registry;
    private final AdmissionQueue queue;
    private final CancellationToken cancellation;
    private final TaskObserver observer;
    private final PoolConfig config;
    private final int maxWorkers;
    private final ThreadPoolExecutor executor;

    private final ReentrantLock lock = new ReentrantLock();
    private int running = 0; // guarded by lock
    private int peakRunning = 0; // guarded by lock
    // written under lock, read lock-free by join waiters holding the registry lock
    private volatile boolean open = false;
    private volatile boolean shutdown = false;

    /**
     * Create a controller.
     *
     * @param registry     records to transition and query
     * @param queue        names waiting for admission
     * @param cancellation stops admission once set
     * @param observer     progress callback handed to each execution
     * @param config       configuration; {@code maxWorkers} must be positive
     * @throws ConfigurationException if {@code maxWorkers <= 0}
     */
    public WorkerPoolController(TaskRegistry registry,
            AdmissionQueue queue,
            CancellationToken cancellation,
            TaskObserver observer,
            PoolConfig config) {
        this(registry, queue, cancellation, observer, config, newExecutor(config));
    }

    WorkerPoolController(TaskRegistry registry,
            AdmissionQueue queue,
            CancellationToken cancellation,
            TaskObserver observer,
            PoolConfig config,
            ThreadPoolExecutor executor) {
        this.registry = registry;
        this.queue = queue;
        this.cancellation = cancellation;
        this.observer = observer;
        this.config = config;
        this.maxWorkers = requirePositive(config.maxWorkers());
        this.executor = executor;
    }

    private static int requirePositive(int maxWorkers) {
        if (maxWorkers <= 0) {
            throw new ConfigurationException("maxWorkers must be positive, got " + maxWorkers);
        }
        return maxWorkers;
    }

    private static ThreadPoolExecutor newExecutor(PoolConfig config) {
        int maxWorkers = requirePositive(config.maxWorkers());
        AtomicInteger threadSeq = new AtomicInteger();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(maxWorkers, maxWorkers,
                60, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                r -> {
                    Thread t = new Thread(r, config.threadNamePrefix() + "-worker-" + threadSeq.incrementAndGet());
                    t.setDaemon(config.daemon());
                    return t;
                });
        // idle non-daemon workers must not pin the JVM
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * Queue a PENDING record for admission and run a dispatch pass.
     */
    public void enqueue(String name, int priority) {
        queue.push(name, priority);
        log.debug("Queued task {} (priority {}, {} waiting)", name, priority, queue.size());
        dispatch();
    }

    /**
     * Open the admission gate.
     *
     * @return names admitted by this call; empty if cancellation is set
     */
    public List<String> open() {
        lock.lock();
        try {
            if (cancellation.isCancelled()) {
                log.warn("Cancel flag set; start skipped ({} tasks waiting)", queue.size());
                return List.of();
            }
            if (shutdown) {
                log.warn("Controller shut down; start skipped");
                return List.of();
            }
            if (!open) {
                open = true;
                log.info("Admission opened: {} queued, up to {} workers", queue.size(), maxWorkers);
            }
            return dispatch();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Admit queued tasks while slots are free.
     *
     * @return names admitted by this pass
     */
    public List<String> dispatch() {
        lock.lock();
        try {
            List<String> admitted = new ArrayList<>();
            while (isAdmitting() && running < maxWorkers) {
                Optional<String> next = queue.pop();
                if (next.isEmpty()) {
                    break;
                }
                String name = next.get();
                // the queue only holds names; skip any that are no longer PENDING
                Optional<TaskRecord> record = registry.find(name);
                if (record.isEmpty() || record.get().state() != TaskState.PENDING) {
                    log.debug("Dropping stale queue entry {}", name);
                    continue;
                }
                // RUNNING is stamped here, under the lock, so start order follows pop order
                registry.transition(name, r -> r.toBuilder()
                        .state(TaskState.RUNNING)
                        .startedAt(Instant.now())
                        .build());
                try {
                    executor.execute(new TaskExecution(name, registry, observer, cancellation,
                            config.threadNamePrefix(), this::release));
                } catch (RejectedExecutionException e) {
                    log.error("Worker pool rejected task {}", name, e);
                    registry.transition(name, r -> r.toBuilder()
                            .state(TaskState.FAILED)
                            .failure(e)
                            .finishedAt(Instant.now())
                            .build());
                    continue;
                }
                running++;
                peakRunning = Math.max(peakRunning, running);
                admitted.add(name);
                log.debug("Admitted task {} ({}/{} running)", name, running, maxWorkers);
            }
            return admitted;
        } finally {
            lock.unlock();
        }
    }

    private boolean isAdmitting() {
        return open && !shutdown && !cancellation.isCancelled();
    }

    private void release(String name) {
        lock.lock();
        try {
            running--;
            log.debug("Task {} released its slot ({}/{} running)", name, running, maxWorkers);
        } finally {
            lock.unlock();
        }
        dispatch();
    }

    /** Whether the gate is open and cancellation has not been requested */
    public boolean isAdmissionOpen() {
        return isAdmitting();
    }

    public int runningCount() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    /** Highest number of simultaneously admitted tasks seen so far */
    public int peakRunningCount() {
        lock.lock();
        try {
            return peakRunning;
        } finally {
            lock.unlock();
        }
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public int queuedCount() {
        return queue.size();
    }

    /**
     * Stop admitting and release the worker threads once they go idle.
     * Running bodies are never interrupted; non-daemon workers get up to
     * {@code timeout} to finish.
     *
     * @return true if every worker thread terminated in time
     */
    public boolean shutdown(Duration timeout) {
        lock.lock();
        try {
            shutdown = true;
        } finally {
            lock.unlock();
        }
        executor.shutdown();
        if (config.daemon()) {
            // daemon workers are abandonable on exit
            return executor.isTerminated();
        }
        try {
            boolean terminated = executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!terminated) {
                log.warn("Worker threads still busy after {}ms", timeout.toMillis());
            }
            return terminated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return executor.isTerminated();
        }
    }

    @Override
    public void close() {
        shutdown(config.closeTimeout());
    }
}
