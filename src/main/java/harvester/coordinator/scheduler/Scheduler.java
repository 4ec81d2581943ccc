package harvester.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs background maintenance on a single-threaded executor.
 * Currently only the {@link ClaimReaper}.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final ClaimReaper claimReaper;
    private final Duration reaperInterval;

    private volatile boolean running = false;

    public Scheduler(ClaimReaper claimReaper, Duration reaperInterval) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "harvester-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.claimReaper = claimReaper;
        this.reaperInterval = reaperInterval;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long intervalMs = reaperInterval.toMillis();
        executor.scheduleAtFixedRate(
                claimReaper,
                intervalMs, // initial delay
                intervalMs,
                TimeUnit.MILLISECONDS);
        log.info("Claim reaper scheduled every {}ms", intervalMs);
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public ClaimReaper claimReaper() {
        return claimReaper;
    }
}
