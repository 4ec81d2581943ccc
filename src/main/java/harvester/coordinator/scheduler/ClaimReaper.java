package harvester.coordinator.scheduler;

import harvester.coordinator.model.Batch;
import harvester.coordinator.queue.BatchQueue;
import harvester.coordinator.queue.BatchTask;
import harvester.coordinator.repository.BatchRepository;
import harvester.coordinator.worker.BatchListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background task that recovers batches stuck in CLAIMED.
 *
 * A claim goes stale when its worker dies mid-batch or the process is killed.
 * The reaper:
 * 1. Finds batches CLAIMED longer than the threshold
 * 2. For each stuck batch:
 * - If attempts remain: return it to PENDING and re-enqueue it
 * - Otherwise: mark it FAILED, which fails its job
 */
public class ClaimReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ClaimReaper.class);

    private final BatchRepository batchRepository;
    private final BatchQueue queue;
    private final BatchListener listener;
    private final Duration stuckThreshold;

    public ClaimReaper(BatchRepository batchRepository, BatchQueue queue, BatchListener listener,
            Duration stuckThreshold) {
        this.batchRepository = batchRepository;
        this.queue = queue;
        this.listener = listener;
        this.stuckThreshold = stuckThreshold;
    }

    @Override
    public void run() {
        try {
            reapStuckClaims();
        } catch (Exception e) {
            log.error("Claim reaper error", e);
        }
    }

    /**
     * Find and recover stuck CLAIMED batches.
     *
     * @return number of batches recovered or expired
     */
    public int reapStuckClaims() {
        Instant cutoff = Instant.now().minus(stuckThreshold);

        List<Batch> stuck = batchRepository.findStuckClaimed(cutoff);

        if (stuck.isEmpty()) {
            log.debug("No stuck claims found");
            return 0;
        }

        int released = 0;
        int expired = 0;

        for (Batch batch : stuck) {
            try {
                if (batch.canRetry()) {
                    String reason = "Claim by " + batch.claimedBy() + " expired";
                    if (batchRepository.releaseClaim(batch.id(), batch.claimedBy(), reason)) {
                        queue.enqueue(new BatchTask(batch.jobId(), batch.id(), batch.index()));
                        released++;
                        log.info("Released stuck batch {} of job {} for retry (attempt {} of {})",
                                batch.index(), batch.jobId(), batch.attemptCount(), batch.maxAttempts());
                    }
                } else {
                    String reason = "Batch stuck in CLAIMED - max attempts exceeded ("
                            + batch.attemptCount() + "/" + batch.maxAttempts() + ")";
                    if (batchRepository.expireClaim(batch.id(), batch.claimedBy(), reason)) {
                        expired++;
                        log.warn("Batch {} of job {} permanently failed after {} attempts (stuck in CLAIMED)",
                                batch.index(), batch.jobId(), batch.attemptCount());
                        listener.onBatchFailedPermanently(batch, reason);
                    }
                }
            } catch (Exception e) {
                log.error("Failed to reap batch {} of job {}", batch.index(), batch.jobId(), e);
            }
        }

        log.info("Claim reaper: {} released, {} expired, {} total stuck",
                released, expired, stuck.size());

        return released + expired;
    }
}
