package conductor.taskpool.queue;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionQueueTest {

    @Test
    void popsSmallestPriorityFirst() {
        AdmissionQueue queue = new AdmissionQueue();
        queue.push("three", 3);
        queue.push("one", 1);
        queue.push("two", 2);

        assertEquals(Optional.of("one"), queue.pop());
        assertEquals(Optional.of("two"), queue.pop());
        assertEquals(Optional.of("three"), queue.pop());
    }

    @Test
    void equalPrioritiesPopInPushOrder() {
        AdmissionQueue queue = new AdmissionQueue();
        for (int i = 0; i < 20; i++) {
            queue.push("t" + i, 7);
        }

        for (int i = 0; i < 20; i++) {
            assertEquals(Optional.of("t" + i), queue.pop());
        }
    }

    @Test
    void negativePrioritiesComeFirst() {
        AdmissionQueue queue = new AdmissionQueue();
        queue.push("zero", 0);
        queue.push("urgent", -5);

        assertEquals(Optional.of("urgent"), queue.pop());
    }

    @Test
    void popOnEmptyQueueReturnsEmpty() {
        AdmissionQueue queue = new AdmissionQueue();

        assertTrue(queue.pop().isEmpty());
        assertTrue(queue.isEmpty());
        assertEquals(0, queue.size());
    }

    @Test
    void snapshotIsInPopOrder() {
        AdmissionQueue queue = new AdmissionQueue();
        queue.push("b", 2);
        queue.push("a", 1);
        queue.push("b2", 2);

        assertEquals(List.of("a", "b", "b2"), queue.snapshot());
        assertEquals(3, queue.size()); // snapshot does not consume
    }

    @Test
    void concurrentPopsNeverReturnANameTwice() throws InterruptedException {
        AdmissionQueue queue = new AdmissionQueue();
        int total = 2000;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        Set<String> seen = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();

        // Two producers push while six consumers pop
        for (int p = 0; p < 2; p++) {
            int offset = p * (total / 2);
            pool.submit(() -> {
                for (int i = 0; i < total / 2; i++) {
                    queue.push("n" + (offset + i), i % 5);
                }
            });
        }
        for (int c = 0; c < 6; c++) {
            pool.submit(() -> {
                while (seen.size() < total) {
                    queue.pop().ifPresent(name -> {
                        if (!seen.add(name)) {
                            duplicates.incrementAndGet();
                        }
                    });
                }
            });
        }

        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(0, duplicates.get());
        assertEquals(total, seen.size());
        assertTrue(queue.isEmpty());
    }

    @Test
    void nullNameIsRejected() {
        AdmissionQueue queue = new AdmissionQueue();
        assertThrows(NullPointerException.class, () -> queue.push(null, 0));
        assertEquals(new ArrayList<String>(), queue.snapshot());
    }
}
