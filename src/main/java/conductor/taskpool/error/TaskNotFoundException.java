package conductor.taskpool.error;

public class TaskNotFoundException extends SchedulerException {

    private final String taskName;

    public TaskNotFoundException(String taskName) {
        super("No task named '" + taskName + "'");
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
