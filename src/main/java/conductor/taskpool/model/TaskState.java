package conductor.taskpool.model;

/**
 * Lifecycle state of a task record.
 * Transitions only move forward: PENDING -> RUNNING -> SUCCEEDED | FAILED.
 */
public enum TaskState {
    /** Registered, waiting for admission */
    PENDING,
    /** Admitted and executing on a worker thread */
    RUNNING,
    /** Body returned normally */
    SUCCEEDED,
    /** Body raised; the cause is kept on the record */
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    /**
     * Whether a record in this state may move to {@code next}.
     */
    public boolean canMoveTo(TaskState next) {
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next == SUCCEEDED || next == FAILED;
            case SUCCEEDED, FAILED -> false;
        };
    }
}
