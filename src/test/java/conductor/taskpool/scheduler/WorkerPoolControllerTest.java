package conductor.taskpool.scheduler;

import conductor.taskpool.config.PoolConfig;
import conductor.taskpool.core.CancellationToken;
import conductor.taskpool.error.ConfigurationException;
import conductor.taskpool.model.TaskBody;
import conductor.taskpool.model.TaskRecord;
import conductor.taskpool.model.TaskState;
import conductor.taskpool.observer.TaskObserver;
import conductor.taskpool.queue.AdmissionQueue;
import conductor.taskpool.repository.InMemoryTaskRegistry;
import conductor.taskpool.service.TaskNames;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolControllerTest {

    private InMemoryTaskRegistry registry;
    private AdmissionQueue queue;
    private CancellationToken cancellation;
    private WorkerPoolController controller;

    private WorkerPoolController controller(int maxWorkers) {
        registry = new InMemoryTaskRegistry(Duration.ofMillis(20));
        queue = new AdmissionQueue();
        cancellation = new CancellationToken();
        controller = new WorkerPoolController(registry, queue, cancellation, TaskObserver.NOOP,
                PoolConfig.defaults().withMaxWorkers(maxWorkers).withDaemon(true));
        return controller;
    }

    @AfterEach
    void tearDown() {
        if (controller != null) {
            controller.shutdown(Duration.ofSeconds(1));
        }
    }

    private void submit(String name, int priority, TaskBody body) {
        registry.register(TaskRecord.builder()
                .id(TaskNames.newId())
                .name(name)
                .body(body)
                .priority(priority)
                .createdAt(Instant.now())
                .build());
        controller.enqueue(name, priority);
    }

    @Test
    void zeroWorkersIsAConfigurationError() {
        assertThrows(ConfigurationException.class, () -> controller(0));
        assertThrows(ConfigurationException.class, () -> controller(-3));
    }

    @Test
    void nothingIsAdmittedBeforeOpen() throws Exception {
        controller(2);
        submit("a", 0, ctx -> "a");

        Thread.sleep(50);

        assertEquals(TaskState.PENDING, registry.get("a").state());
        assertEquals(0, controller.runningCount());
        assertEquals(1, controller.queuedCount());
        assertFalse(controller.isAdmissionOpen());
    }

    @Test
    void openAdmitsUpToTheCap() throws Exception {
        controller(2);
        CountDownLatch release = new CountDownLatch(1);
        TaskBody blocking = ctx -> release.await(5, TimeUnit.SECONDS);
        submit("a", 0, blocking);
        submit("b", 0, blocking);
        submit("c", 0, blocking);

        List<String> admitted = controller.open();

        assertEquals(List.of("a", "b"), admitted);
        assertEquals(2, controller.runningCount());
        assertEquals(1, controller.queuedCount());

        release.countDown();
        assertTrue(registry.awaitDrained(controller::isAdmissionOpen, Duration.ofSeconds(5)).isEmpty());
        assertEquals(TaskState.SUCCEEDED, registry.get("c").state());
        assertEquals(2, controller.peakRunningCount());
    }

    @Test
    void submissionsAfterOpenAreAdmittedAutomatically() throws Exception {
        controller(1);
        controller.open();

        submit("late", 0, ctx -> "ok");

        assertTrue(registry.awaitCompletion("late", Duration.ofSeconds(5)));
        assertEquals("ok", registry.get("late").result());
    }

    @Test
    void cancellationBlocksOpen() throws Exception {
        controller(2);
        submit("a", 0, ctx -> "a");
        cancellation.cancel();

        assertTrue(controller.open().isEmpty());
        Thread.sleep(50);
        assertEquals(TaskState.PENDING, registry.get("a").state());
    }

    @Test
    void cancellationStopsFurtherAdmission() throws Exception {
        controller(1);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        submit("first", 0, ctx -> {
            started.countDown();
            return release.await(5, TimeUnit.SECONDS);
        });
        submit("second", 1, ctx -> "never");
        controller.open();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        cancellation.cancel();
        release.countDown();

        assertTrue(registry.awaitCompletion("first", Duration.ofSeconds(5)));
        Thread.sleep(50);
        assertEquals(TaskState.PENDING, registry.get("second").state());
        assertEquals(0, controller.runningCount());
    }

    @Test
    void staleQueueEntriesAreSkipped() throws Exception {
        controller(1);
        submit("real", 0, ctx -> "ok");
        queue.push("ghost", -1); // no record behind it

        List<String> admitted = controller.open();

        assertEquals(List.of("real"), admitted);
        assertTrue(registry.awaitCompletion("real", Duration.ofSeconds(5)));
    }

    @Test
    void workerThreadsFollowTheDaemonSetting() throws Exception {
        controller(1);
        submit("daemon-check", 0, ctx -> Thread.currentThread().isDaemon());
        controller.open();

        assertTrue(registry.awaitCompletion("daemon-check", Duration.ofSeconds(5)));
        assertEquals(Boolean.TRUE, registry.get("daemon-check").result());
    }

    @Test
    void shutdownStopsAdmission() {
        controller(1);
        submit("a", 0, ctx -> "a");

        controller.shutdown(Duration.ofMillis(100));

        assertTrue(controller.open().isEmpty());
        assertEquals(TaskState.PENDING, registry.get("a").state());
    }

    @Test
    void admittedTasksAreRunningBeforeOpenReturns() throws Exception {
        controller(3);
        CountDownLatch release = new CountDownLatch(1);
        TaskBody blocking = ctx -> release.await(5, TimeUnit.SECONDS);
        for (int i = 0; i < 4; i++) {
            submit("t" + i, 0, blocking);
        }

        List<String> admitted = controller.open();
        cancellation.cancel();

        // no admitted task is left PENDING for a worker thread to pick up later
        assertEquals(List.of("t0", "t1", "t2"), admitted);
        for (String name : admitted) {
            TaskRecord record = registry.get(name);
            assertEquals(TaskState.RUNNING, record.state());
            assertNotNull(record.startedAt());
        }
        assertEquals(TaskState.PENDING, registry.get("t3").state());
        assertEquals(List.of("t0", "t1", "t2", "t3"),
                registry.awaitDrained(controller::isAdmissionOpen, Duration.ZERO));

        release.countDown();
        assertEquals(List.of("t3"), registry.awaitDrained(controller::isAdmissionOpen, Duration.ofSeconds(5)));
    }

    @Test
    void rejectedExecutionFailsTaskAndKeepsSlotFree() throws Exception {
        registry = new InMemoryTaskRegistry(Duration.ofMillis(20));
        queue = new AdmissionQueue();
        cancellation = new CancellationToken();
        ThreadPoolExecutor closed = new ThreadPoolExecutor(1, 1, 0, TimeUnit.SECONDS, new LinkedBlockingQueue<>());
        closed.shutdown();
        controller = new WorkerPoolController(registry, queue, cancellation, TaskObserver.NOOP,
                PoolConfig.defaults().withMaxWorkers(1), closed);
        submit("a", 0, ctx -> "a");
        submit("b", 0, ctx -> "b");

        List<String> admitted = controller.open();

        assertTrue(admitted.isEmpty());
        assertEquals(0, controller.runningCount());
        assertEquals(TaskState.FAILED, registry.get("a").state());
        assertInstanceOf(RejectedExecutionException.class, registry.get("a").failure());
        assertEquals(TaskState.FAILED, registry.get("b").state());
        assertTrue(registry.awaitCompletion("a", Duration.ZERO));
    }
}
