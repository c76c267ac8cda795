package conductor.taskpool.error;

/**
 * Submission used a name that is still held by a registry record.
 */
public class DuplicateTaskNameException extends SchedulerException {

    private final String taskName;

    public DuplicateTaskNameException(String taskName) {
        super("Task name already registered: " + taskName);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
