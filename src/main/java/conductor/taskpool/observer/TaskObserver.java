package conductor.taskpool.observer;

import conductor.taskpool.model.TaskState;

/**
 * Callback for progress rendering. Called from worker threads; a failing
 * observer is logged and otherwise ignored.
 */
public interface TaskObserver {

    TaskObserver NOOP = new TaskObserver() {
    };

    /** Task admitted; {@code completed} is always 0 */
    default void onAdmitted(String name, long completed, long total) {
    }

    /** Task reported a new progress value */
    default void onProgress(String name, long completed, long total) {
    }

    /** Task reached a terminal state */
    default void onCompleted(String name, TaskState state, long completed, long total) {
    }
}
