package conductor.taskpool.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by the pool and its task bodies.
 * Once set it stays set; running work is never interrupted by it.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return true if this call set the signal
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + cancelled.get() + "}";
    }
}
