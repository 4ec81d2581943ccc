package harvester.coordinator.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Fixed-size pool of {@link BatchWorker}s. The pool size is the ceiling on
 * concurrent extraction calls.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final int size;
    private final Function<String, BatchWorker> workerFactory;
    private final String instanceId;

    private ExecutorService executor;
    private final List<BatchWorker> workers = new ArrayList<>();

    /**
     * @param size          number of worker threads
     * @param instanceId    prefix making worker ids unique across processes
     * @param workerFactory creates a worker for a given worker id
     */
    public WorkerPool(int size, String instanceId, Function<String, BatchWorker> workerFactory) {
        if (size <= 0) {
            throw new IllegalArgumentException("worker pool size must be positive");
        }
        this.size = size;
        this.instanceId = instanceId;
        this.workerFactory = workerFactory;
    }

    public synchronized void start() {
        if (executor != null) {
            log.warn("Worker pool already running");
            return;
        }

        AtomicInteger threadSeq = new AtomicInteger();
        executor = Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "harvester-worker-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        for (int i = 1; i <= size; i++) {
            BatchWorker worker = workerFactory.apply(instanceId + "-" + i);
            workers.add(worker);
            executor.submit(worker);
        }
        log.info("Worker pool started with {} workers", size);
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }

        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not stop within 10s");
            } else {
                log.info("Worker pool stopped");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            executor = null;
            workers.clear();
        }
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    public int size() {
        return size;
    }

    @Override
    public void close() {
        stop();
    }
}
