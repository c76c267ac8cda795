package conductor.taskpool.error;

/**
 * Base type for errors surfaced synchronously by the task pool.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
