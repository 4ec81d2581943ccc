package harvester.coordinator.repository;

import harvester.coordinator.model.Batch;
import harvester.coordinator.model.BatchCompleteResult;
import harvester.coordinator.model.BatchFailResult;
import harvester.coordinator.model.BatchStatus;
import harvester.coordinator.model.JobCounts;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for Batch persistence.
 * The claim operations are the only concurrency-control point of the pipeline
 * and must be a single atomic conditional update.
 */
public interface BatchRepository {

    Optional<Batch> findById(String batchId);

    Optional<Batch> findByJobIdAndIndex(String jobId, int index);

    /**
     * All batches of a job in ascending index order.
     */
    List<Batch> findByJobId(String jobId);

    /**
     * Batches of a job that may still change state (PENDING or CLAIMED), by index.
     */
    List<Batch> findOutstanding(String jobId);

    /**
     * Ids of the job's COMPLETED batches (the progress ledger).
     */
    Set<String> findCompletedIds(String jobId);

    JobCounts countByJobId(String jobId);

    int countByStatus(BatchStatus status);

    /**
     * Atomically claim a specific batch: PENDING -> CLAIMED, attempt count + 1.
     * Refused when the batch is not PENDING, its attempts are exhausted, or its
     * job is terminal.
     *
     * @return the claimed batch, or empty if the claim was refused
     */
    Optional<Batch> claim(String batchId, String workerId);

    /**
     * Atomically claim any eligible batch of a job, lowest index first.
     *
     * @return the claimed batch, or empty if none is eligible
     */
    Optional<Batch> claimNext(String jobId, String workerId);

    /**
     * CLAIMED -> COMPLETED. Only the claiming worker may complete a batch.
     */
    BatchCompleteResult complete(String batchId, String workerId, String outputRef, int recordCount);

    /**
     * Report a failed attempt. Returns the batch to PENDING when the failure is
     * retriable and attempts remain, otherwise marks it FAILED.
     */
    BatchFailResult fail(String batchId, String workerId, String errorMessage, boolean retriable);

    /**
     * Batches CLAIMED before the given instant (their worker probably died).
     */
    List<Batch> findStuckClaimed(Instant claimedBefore);

    /**
     * Return a stuck claim to PENDING, provided it is still held by the same worker.
     *
     * @return true if released
     */
    boolean releaseClaim(String batchId, String workerId, String reason);

    /**
     * Mark a stuck claim permanently FAILED, provided it is still held by the same worker.
     *
     * @return true if updated
     */
    boolean expireClaim(String batchId, String workerId, String reason);
}
