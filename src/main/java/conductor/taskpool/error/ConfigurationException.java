package conductor.taskpool.error;

/**
 * Invalid pool configuration. Raised at construction time and never retried.
 */
public class ConfigurationException extends SchedulerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
