package conductor.taskpool.scheduler;

import conductor.taskpool.model.TaskRecord;
import conductor.taskpool.model.TaskState;
import conductor.taskpool.repository.TaskRegistry;
import conductor.taskpool.service.TaskNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resubmits failed tasks as fresh records.
 *
 * The resubmission:
 * 1. Finds records that are FAILED at the time of the call
 * 2. For each one not resubmitted before: register a copy under a name
 * derived from the root name and queue it
 *
 * The failed record itself is never modified, so it stays in failures().
 */
public class RetryCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RetryCoordinator.class);

    private final TaskRegistry registry;
    private final WorkerPoolController controller;

    // record IDs already resubmitted
    private final Set<String> handled = ConcurrentHashMap.newKeySet();

    public RetryCoordinator(TaskRegistry registry, WorkerPoolController controller) {
        this.registry = registry;
        this.controller = controller;
    }

    /**
     * Resubmit every record currently FAILED.
     *
     * @return names of the new records, in registry order of their originals
     */
    public synchronized List<String> retryFailed() {
        List<TaskRecord> failed = registry.findByState(TaskState.FAILED);

        if (failed.isEmpty()) {
            log.debug("No failed tasks to retry");
            return List.of();
        }

        List<String> resubmitted = new ArrayList<>();
        int skipped = 0;

        for (TaskRecord task : failed) {
            if (!handled.add(task.id())) {
                skipped++;
                continue;
            }
            TaskRecord retry = registry.registerUnique(task.rootName(), name -> copyForRetry(task, name));
            resubmitted.add(retry.name());
            log.info("Retrying task {} as {} (attempt {})", task.name(), retry.name(), retry.attempt());
            controller.enqueue(retry.name(), retry.priority());
        }

        log.info("Retry: {} resubmitted, {} already retried, {} failed in total",
                resubmitted.size(), skipped, failed.size());
        return resubmitted;
    }

    private static TaskRecord copyForRetry(TaskRecord failed, String name) {
        return TaskRecord.builder()
                .id(TaskNames.newId())
                .name(name)
                .rootName(failed.rootName())
                .body(failed.body())
                .args(failed.args())
                .priority(failed.priority())
                .totalUnits(failed.totalUnits())
                .attempt(failed.attempt() + 1)
                .retryOf(failed.name())
                .createdAt(Instant.now())
                .build();
    }

    /**
     * Forget records that are no longer in the registry.
     */
    public void prune() {
        Set<String> live = ConcurrentHashMap.newKeySet();
        for (TaskRecord record : registry.snapshot()) {
            live.add(record.id());
        }
        handled.retainAll(live);
    }
}
