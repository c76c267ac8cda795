package conductor.taskpool.observer;

import conductor.taskpool.model.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Renders task progress as log lines.
 * Progress lines are throttled to whole-percent changes per task.
 */
public class LoggingTaskObserver implements TaskObserver {

    private static final Logger log = LoggerFactory.getLogger(LoggingTaskObserver.class);

    private final Map<String, Integer> lastPercent = new ConcurrentHashMap<>();

    @Override
    public void onAdmitted(String name, long completed, long total) {
        lastPercent.put(name, 0);
        log.info("[{}] started {}/{}", name, completed, total);
    }

    @Override
    public void onProgress(String name, long completed, long total) {
        int percent = percent(completed, total);
        Integer previous = lastPercent.put(name, percent);
        if (previous == null || previous != percent) {
            log.info("[{}] {}% ({}/{})", name, percent, completed, total);
        }
    }

    @Override
    public void onCompleted(String name, TaskState state, long completed, long total) {
        lastPercent.remove(name);
        if (state == TaskState.FAILED) {
            log.warn("[{}] {} at {}/{}", name, state, completed, total);
        } else {
            log.info("[{}] {} {}/{}", name, state, completed, total);
        }
    }

    static int percent(long completed, long total) {
        if (total <= 0) {
            return 100;
        }
        return (int) (completed * 100 / total);
    }
}
