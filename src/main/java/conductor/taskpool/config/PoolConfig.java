package conductor.taskpool.config;

import conductor.taskpool.error.ConfigurationException;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for task pool settings.
 * All settings have sensible defaults; {@link #validate()} is called by the
 * pool at construction.
 */
public final class PoolConfig {

    // Worker settings
    private int maxWorkers = 4;
    private boolean daemon = false;
    private String threadNamePrefix = "conductor";

    // Timing
    private Duration pollInterval = Duration.ofMillis(100);
    private Duration closeTimeout = Duration.ofSeconds(5);

    private PoolConfig() {
    }

    public static PoolConfig defaults() {
        return new PoolConfig();
    }

    public static PoolConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Build a config from an environment map. Unset or blank variables keep
     * their defaults.
     *
     * @throws ConfigurationException if a variable is set but unparseable
     */
    public static PoolConfig fromEnv(Map<String, String> env) {
        PoolConfig config = new PoolConfig();

        String maxWorkers = env.get("CONDUCTOR_MAX_WORKERS");
        if (maxWorkers != null && !maxWorkers.isBlank()) {
            config.maxWorkers = parseInt("CONDUCTOR_MAX_WORKERS", maxWorkers);
        }

        String daemon = env.get("CONDUCTOR_DAEMON");
        if (daemon != null && !daemon.isBlank()) {
            config.daemon = Boolean.parseBoolean(daemon.trim());
        }

        String closeTimeoutMs = env.get("CONDUCTOR_CLOSE_TIMEOUT_MS");
        if (closeTimeoutMs != null && !closeTimeoutMs.isBlank()) {
            config.closeTimeout = Duration.ofMillis(parseInt("CONDUCTOR_CLOSE_TIMEOUT_MS", closeTimeoutMs));
        }

        return config;
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + raw + "'", e);
        }
    }

    /**
     * @throws ConfigurationException if any setting is out of range
     */
    public PoolConfig validate() {
        if (maxWorkers <= 0) {
            throw new ConfigurationException("maxWorkers must be positive, got " + maxWorkers);
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new ConfigurationException("pollInterval must be positive, got " + pollInterval);
        }
        if (closeTimeout == null || closeTimeout.isNegative()) {
            throw new ConfigurationException("closeTimeout must not be negative, got " + closeTimeout);
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new ConfigurationException("threadNamePrefix is required");
        }
        return this;
    }

    // Getters
    public int maxWorkers() {
        return maxWorkers;
    }

    public boolean daemon() {
        return daemon;
    }

    public String threadNamePrefix() {
        return threadNamePrefix;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration closeTimeout() {
        return closeTimeout;
    }

    // Fluent setters for testing/customization
    public PoolConfig withMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
        return this;
    }

    public PoolConfig withDaemon(boolean daemon) {
        this.daemon = daemon;
        return this;
    }

    public PoolConfig withThreadNamePrefix(String prefix) {
        this.threadNamePrefix = prefix;
        return this;
    }

    public PoolConfig withPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
        return this;
    }

    public PoolConfig withCloseTimeout(Duration closeTimeout) {
        this.closeTimeout = closeTimeout;
        return this;
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "maxWorkers=" + maxWorkers +
                ", daemon=" + daemon +
                ", pollInterval=" + pollInterval +
                ", closeTimeout=" + closeTimeout +
                '}';
    }
}
