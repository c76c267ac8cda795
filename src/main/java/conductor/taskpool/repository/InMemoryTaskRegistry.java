package conductor.taskpool.repository;

import conductor.taskpool.error.DuplicateTaskNameException;
import conductor.taskpool.error.TaskNotFoundException;
import conductor.taskpool.model.TaskRecord;
import conductor.taskpool.model.TaskState;
import conductor.taskpool.service.TaskNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * {@link TaskRegistry} backed by an insertion-ordered map behind one lock.
 * Waiters are woken on every transition and, as a fallback, every
 * {@code pollInterval}.
 */
public final class InMemoryTaskRegistry implements TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskRegistry.class);

    private static final class Entry {
        TaskRecord record;
        final CountDownLatch done = new CountDownLatch(1);

        Entry(TaskRecord record) {
            this.record = record;
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final long pollNanos;

    public InMemoryTaskRegistry(Duration pollInterval) {
        this.pollNanos = Objects.requireNonNull(pollInterval, "pollInterval is required").toNanos();
    }

    @Override
    public TaskRecord register(TaskRecord record) {
        lock.lock();
        try {
            if (entries.containsKey(record.name())) {
                throw new DuplicateTaskNameException(record.name());
            }
            insert(record);
            return record;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TaskRecord registerUnique(String baseName, Function<String, TaskRecord> factory) {
        lock.lock();
        try {
            String name = TaskNames.disambiguate(baseName, entries::containsKey);
            TaskRecord record = factory.apply(name);
            if (!name.equals(record.name())) {
                throw new IllegalArgumentException("factory built '" + record.name() + "' for name '" + name + "'");
            }
            insert(record);
            return record;
        } finally {
            lock.unlock();
        }
    }

    private void insert(TaskRecord record) {
        Entry entry = new Entry(record);
        if (record.isTerminal()) {
            entry.done.countDown();
        }
        entries.put(record.name(), entry);
        log.debug("Registered task {} (priority {})", record.name(), record.priority());
        changed.signalAll();
    }

    @Override
    public Optional<TaskRecord> find(String name) {
        lock.lock();
        try {
            Entry entry = entries.get(name);
            return entry == null ? Optional.empty() : Optional.of(entry.record);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TaskRecord get(String name) {
        return find(name).orElseThrow(() -> new TaskNotFoundException(name));
    }

    @Override
    public boolean contains(String name) {
        lock.lock();
        try {
            return entries.containsKey(name);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public TaskRecord transition(String name, UnaryOperator<TaskRecord> change) {
        lock.lock();
        try {
            Entry entry = require(name);
            TaskRecord current = entry.record;
            TaskRecord next = change.apply(current);
            if (!current.id().equals(next.id()) || !current.name().equals(next.name())) {
                throw new IllegalStateException("Transition of " + name + " changed its identity");
            }
            if (current.state() != next.state() && !current.state().canMoveTo(next.state())) {
                throw new IllegalStateException("Task " + name + " cannot move from "
                        + current.state() + " to " + next.state());
            }
            if (current.isTerminal() && current != next) {
                throw new IllegalStateException("Task " + name + " is " + current.state() + " and can no longer change");
            }
            entry.record = next;
            if (next.isTerminal()) {
                entry.done.countDown();
            }
            changed.signalAll();
            return next;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean awaitCompletion(String name, Duration timeout) throws InterruptedException {
        CountDownLatch done;
        lock.lock();
        try {
            done = require(name).done;
        } finally {
            lock.unlock();
        }
        if (timeout == null) {
            done.await();
            return true;
        }
        return done.await(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
    }

    @Override
    public List<String> awaitDrained(BooleanSupplier admissionOpen, Duration timeout) throws InterruptedException {
        long deadline = timeout == null ? 0 : System.nanoTime() + Math.max(0, timeout.toNanos());
        lock.lock();
        try {
            while (!isDrained(admissionOpen.getAsBoolean())) {
                long wait = pollNanos;
                if (timeout != null) {
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        break;
                    }
                    wait = Math.min(wait, remaining);
                }
                changed.awaitNanos(wait);
            }
            return namesWhere(r -> !r.isTerminal());
        } finally {
            lock.unlock();
        }
    }

    private boolean isDrained(boolean admissionOpen) {
        for (Entry entry : entries.values()) {
            TaskState state = entry.record.state();
            if (state == TaskState.RUNNING || (admissionOpen && state == TaskState.PENDING)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public List<TaskRecord> snapshot() {
        lock.lock();
        try {
            List<TaskRecord> records = new ArrayList<>(entries.size());
            for (Entry entry : entries.values()) {
                records.add(entry.record);
            }
            return records;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<TaskRecord> findByState(TaskState state) {
        lock.lock();
        try {
            List<TaskRecord> records = new ArrayList<>();
            for (Entry entry : entries.values()) {
                if (entry.record.state() == state) {
                    records.add(entry.record);
                }
            }
            return records;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> allNames() {
        lock.lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> activeNames() {
        return namesInState(TaskState.RUNNING);
    }

    @Override
    public List<String> pendingNames() {
        return namesInState(TaskState.PENDING);
    }

    private List<String> namesInState(TaskState state) {
        lock.lock();
        try {
            return namesWhere(r -> r.state() == state);
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private List<String> namesWhere(Predicate<TaskRecord> filter) {
        List<String> names = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (filter.test(entry.record)) {
                names.add(entry.record.name());
            }
        }
        return names;
    }

    @Override
    public Map<String, Object> results() {
        lock.lock();
        try {
            Map<String, Object> results = new LinkedHashMap<>();
            for (Entry entry : entries.values()) {
                results.put(entry.record.name(), entry.record.result());
            }
            return Collections.unmodifiableMap(results);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, Throwable> failures() {
        lock.lock();
        try {
            Map<String, Throwable> failures = new LinkedHashMap<>();
            for (Entry entry : entries.values()) {
                if (entry.record.state() == TaskState.FAILED) {
                    failures.put(entry.record.name(), entry.record.failure());
                }
            }
            return Collections.unmodifiableMap(failures);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> removeFinished() {
        lock.lock();
        try {
            List<String> removed = new ArrayList<>();
            for (Iterator<Entry> it = entries.values().iterator(); it.hasNext();) {
                TaskRecord record = it.next().record;
                if (record.isTerminal()) {
                    removed.add(record.name());
                    it.remove();
                }
            }
            if (!removed.isEmpty()) {
                log.debug("Removed {} finished tasks", removed.size());
                changed.signalAll();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    private Entry require(String name) {
        Entry entry = entries.get(name);
        if (entry == null) {
            throw new TaskNotFoundException(name);
        }
        return entry;
    }
}
