package harvester.coordinator.queue;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DelayedBatchQueueTest {

    private final DelayedBatchQueue queue = new DelayedBatchQueue();

    @Test
    void readyTasksComeOutInEnqueueOrder() throws Exception {
        queue.enqueue(new BatchTask("job-1", "b0", 0));
        queue.enqueue(new BatchTask("job-1", "b1", 1));
        queue.enqueue(new BatchTask("job-2", "b0", 0));

        assertEquals("b0", queue.take().batchId());
        assertEquals("b1", queue.take().batchId());
        assertEquals("job-2", queue.take().jobId());
        assertNull(queue.poll(Duration.ofMillis(20)));
    }

    @Test
    void delayedTaskIsHeldBack() throws Exception {
        queue.enqueueAfter(new BatchTask("job-1", "late", 0), Duration.ofMillis(300));
        queue.enqueue(new BatchTask("job-1", "now", 1));

        assertEquals(2, queue.size());
        assertEquals("now", queue.poll(Duration.ofMillis(50)).batchId());
        assertNull(queue.poll(Duration.ofMillis(50)));
        assertEquals("late", queue.poll(Duration.ofSeconds(2)).batchId());
    }

    @Test
    void cancelledJobTasksAreDropped() throws Exception {
        queue.enqueue(new BatchTask("job-1", "b0", 0));
        queue.enqueueAfter(new BatchTask("job-1", "b1", 1), Duration.ofMillis(100));
        queue.enqueue(new BatchTask("job-2", "b0", 0));

        queue.cancelJob("job-1");
        queue.enqueue(new BatchTask("job-1", "b2", 2));

        assertEquals(1, queue.size());
        assertEquals("job-2", queue.take().jobId());
        assertNull(queue.poll(Duration.ofMillis(200)));
    }

    @Test
    void duplicateDeliveryIsAllowed() throws Exception {
        BatchTask task = new BatchTask("job-1", "b0", 0);
        queue.enqueue(task);
        queue.enqueue(task);

        Set<BatchTask> seen = new HashSet<>();
        seen.add(queue.take());
        seen.add(queue.take());
        assertEquals(Set.of(task), seen);
    }

    @Test
    void onlyTheMostRecentCancellationsAreRemembered() throws Exception {
        DelayedBatchQueue small = new DelayedBatchQueue(2);
        small.cancelJob("job-1");
        small.cancelJob("job-2");
        small.cancelJob("job-3");

        assertEquals(2, small.cancelledJobCount());

        small.enqueue(new BatchTask("job-3", "b0", 0));
        assertEquals(0, small.size());
        small.enqueue(new BatchTask("job-1", "b0", 0));
        assertEquals("job-1", small.poll(Duration.ZERO).jobId());
    }
}
