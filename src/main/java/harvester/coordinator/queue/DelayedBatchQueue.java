package harvester.coordinator.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process queue backed by a {@link DelayQueue}.
 * Volatile by nature: after a restart the resume controller rebuilds its
 * content from persisted batch state.
 *
 * Cancelled job ids are remembered so late re-enqueues of their batches are
 * dropped. Only the most recent ones are kept; a task of a forgotten job that
 * still arrives is refused at claim time because its job is terminal.
 */
public class DelayedBatchQueue implements BatchQueue {

    private static final Logger log = LoggerFactory.getLogger(DelayedBatchQueue.class);

    static final int DEFAULT_MAX_CANCELLED_JOBS = 10_000;

    private final DelayQueue<Entry> queue = new DelayQueue<>();
    private final Set<String> cancelledJobs;
    private final AtomicLong sequence = new AtomicLong();

    public DelayedBatchQueue() {
        this(DEFAULT_MAX_CANCELLED_JOBS);
    }

    DelayedBatchQueue(int maxCancelledJobs) {
        Map<String, Boolean> recent = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                return size() > maxCancelledJobs;
            }
        };
        this.cancelledJobs = Collections.newSetFromMap(Collections.synchronizedMap(recent));
    }

    @Override
    public void enqueue(BatchTask task) {
        enqueueAfter(task, Duration.ZERO);
    }

    @Override
    public void enqueueAfter(BatchTask task, Duration delay) {
        if (cancelledJobs.contains(task.jobId())) {
            log.debug("Dropping task for cancelled job {}: batch {}", task.jobId(), task.batchIndex());
            return;
        }
        long readyAt = System.nanoTime() + delay.toNanos();
        queue.put(new Entry(task, readyAt, sequence.getAndIncrement()));
    }

    @Override
    public BatchTask take() throws InterruptedException {
        while (true) {
            BatchTask task = queue.take().task;
            if (!cancelledJobs.contains(task.jobId())) {
                return task;
            }
            log.debug("Skipping task of cancelled job {}: batch {}", task.jobId(), task.batchIndex());
        }
    }

    @Override
    public BatchTask poll(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            Entry entry = queue.poll(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
            if (entry == null) {
                return null;
            }
            if (!cancelledJobs.contains(entry.task.jobId())) {
                return entry.task;
            }
            log.debug("Skipping task of cancelled job {}: batch {}", entry.task.jobId(), entry.task.batchIndex());
        }
    }

    @Override
    public void cancelJob(String jobId) {
        cancelledJobs.add(jobId);
        int removed = 0;
        for (Entry entry : queue) {
            if (entry.task.jobId().equals(jobId) && queue.remove(entry)) {
                removed++;
            }
        }
        log.info("Queue stopped dispatching job {} ({} queued tasks dropped)", jobId, removed);
    }

    @Override
    public int size() {
        return queue.size();
    }

    int cancelledJobCount() {
        return cancelledJobs.size();
    }

    private static final class Entry implements Delayed {
        private final BatchTask task;
        private final long readyAtNanos;
        private final long seq; // FIFO among tasks ready at the same instant

        private Entry(BatchTask task, long readyAtNanos, long seq) {
            this.task = task;
            this.readyAtNanos = readyAtNanos;
            this.seq = seq;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(readyAtNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            Entry o = (Entry) other;
            int cmp = Long.compare(readyAtNanos, o.readyAtNanos);
            return cmp != 0 ? cmp : Long.compare(seq, o.seq);
        }
    }
}
