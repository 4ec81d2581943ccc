package harvester.coordinator.queue;

import java.time.Duration;

/**
 * Hands batch tasks to workers and decouples submission rate from processing
 * rate. Delivery is at-least-once; no ordering is guaranteed between tasks.
 */
public interface BatchQueue {

    /**
     * Make a task available immediately.
     */
    void enqueue(BatchTask task);

    /**
     * Make a task available after a delay. Used for retry backoff so no worker
     * thread sleeps while a batch waits.
     */
    void enqueueAfter(BatchTask task, Duration delay);

    /**
     * Block until a task is available.
     */
    BatchTask take() throws InterruptedException;

    /**
     * Wait up to the timeout for a task.
     *
     * @return the task, or null on timeout
     */
    BatchTask poll(Duration timeout) throws InterruptedException;

    /**
     * Stop handing out tasks of a job. Tasks already taken are unaffected.
     */
    void cancelJob(String jobId);

    /**
     * Tasks currently queued, including delayed ones.
     */
    int size();
}
