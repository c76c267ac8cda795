package conductor;

import conductor.taskpool.config.PoolConfig;
import conductor.taskpool.core.TaskPool;
import conductor.taskpool.model.TaskContext;
import conductor.taskpool.model.TaskRequest;
import conductor.taskpool.observer.LoggingTaskObserver;
import conductor.taskpool.util.LockedFileWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Demo entry point.
 *
 * Submits a handful of prioritised tasks that append to a shared output file,
 * one of which fails on its first attempt, then runs, retries and prints the
 * JSON status report.
 *
 * Usage: {@code App [output-file]} (default {@code output.txt}).
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        Path output = Path.of(args.length > 0 ? args[0] : "output.txt");
        LockedFileWriter writer = new LockedFileWriter(output);
        AtomicBoolean failedOnce = new AtomicBoolean(false);

        PoolConfig config = PoolConfig.fromEnv().withMaxWorkers(3);
        try (TaskPool pool = TaskPool.create(config, new LoggingTaskObserver())) {
            for (int i = 1; i <= 5; i++) {
                pool.submit(TaskRequest.builder()
                        .name("Task-" + i)
                        .body(App::writeMessages)
                        .args(writer, i + 1)
                        .priority(i)
                        .totalUnits(i + 1)
                        .build());
            }
            pool.submit(TaskRequest.builder()
                    .name("Flaky")
                    .body(ctx -> {
                        if (failedOnce.compareAndSet(false, true)) {
                            throw new IllegalStateException("first attempt always fails");
                        }
                        ctx.arg(0, LockedFileWriter.class).write("Flaky recovered");
                        return "recovered";
                    })
                    .args(writer)
                    .priority(0)
                    .build());

            List<String> leftover = pool.run();
            log.info("First pass finished, {} left over, {} failed", leftover.size(), pool.failures().size());

            List<String> retried = pool.retryFailed();
            pool.join();
            log.info("Retried {}", retried);

            System.out.println(pool.report().toJson());
        }
        log.info("All tasks have finished execution; output in {}", output.toAbsolutePath());
    }

    private static Object writeMessages(TaskContext ctx) throws InterruptedException {
        LockedFileWriter writer = ctx.arg(0, LockedFileWriter.class);
        int count = ctx.arg(1, Integer.class);
        for (int i = 1; i <= count; i++) {
            if (ctx.isCancelled()) {
                break;
            }
            writer.write(ctx.name() + " message " + i);
            ctx.reportProgress(i);
            Thread.sleep(50);
        }
        return count;
    }
}
