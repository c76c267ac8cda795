package conductor.taskpool.model;

/**
 * Point-in-time status of a task: state, advisory progress and failure cause.
 */
public record TaskStatus(
        String name,
        TaskState state,
        long completedUnits,
        long totalUnits,
        Throwable failure) {

    public static TaskStatus from(TaskRecord record) {
        return new TaskStatus(
                record.name(),
                record.state(),
                record.completedUnits(),
                record.totalUnits(),
                record.failure());
    }

    /** Progress as a fraction in {@code [0, 1]} */
    public double progress() {
        return (double) completedUnits / totalUnits;
    }

    public boolean hasFailed() {
        return state == TaskState.FAILED;
    }
}
