package conductor.taskpool.queue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Priority-ordered holding area for tasks that have not started yet.
 *
 * <p>Entries are only names; the registry stays the source of truth for the
 * records themselves. Smaller priority values pop first, equal priorities pop
 * in push order. All methods are safe to call from any thread.
 */
public final class AdmissionQueue {

    private record Entry(String name, int priority, long sequence) {
    }

    private static final Comparator<Entry> ORDER = Comparator
            .comparingInt(Entry::priority)
            .thenComparingLong(Entry::sequence);

    private final PriorityQueue<Entry> entries = new PriorityQueue<>(ORDER);
    private long nextSequence = 0;

    public synchronized void push(String name, int priority) {
        Objects.requireNonNull(name, "name is required");
        entries.add(new Entry(name, priority, nextSequence++));
    }

    /**
     * Remove and return the highest-priority name, or empty when nothing is
     * queued. Never blocks.
     */
    public synchronized Optional<String> pop() {
        Entry head = entries.poll();
        return head == null ? Optional.empty() : Optional.of(head.name());
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Queued names in the order they would be popped */
    public synchronized List<String> snapshot() {
        List<Entry> ordered = new ArrayList<>(entries);
        ordered.sort(ORDER);
        List<String> names = new ArrayList<>(ordered.size());
        for (Entry e : ordered) {
            names.add(e.name());
        }
        return names;
    }
}
