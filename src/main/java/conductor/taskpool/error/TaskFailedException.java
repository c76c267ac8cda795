package conductor.taskpool.error;

/**
 * Re-raises a recorded task failure when the caller explicitly asks for it.
 * The original failure is available through {@link #getCause()}.
 */
public class TaskFailedException extends SchedulerException {

    private final String taskName;

    public TaskFailedException(String taskName, Throwable cause) {
        super("Task " + taskName + " failed: " + cause, cause);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
