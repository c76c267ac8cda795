package conductor.taskpool.model;

import java.util.List;

/**
 * View handed to a running {@link TaskBody}.
 */
public interface TaskContext {

    /** Name of the record being executed */
    String name();

    /** Arguments captured at submission, in order */
    List<Object> args();

    /**
     * Typed access to a single argument.
     *
     * @throws IndexOutOfBoundsException if there is no argument at {@code index}
     * @throws ClassCastException        if the argument is not a {@code type}
     */
    default <T> T arg(int index, Class<T> type) {
        return type.cast(args().get(index));
    }

    /** Number of progress units declared for this task */
    long totalUnits();

    /**
     * Report advisory progress. Values are clamped to {@code [0, totalUnits]}
     * and never move backwards.
     */
    void reportProgress(long completedUnits);

    /** Whether the pool's cooperative cancellation signal is set */
    boolean isCancelled();
}
