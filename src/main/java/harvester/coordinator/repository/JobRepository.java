package harvester.coordinator.repository;

import harvester.coordinator.model.Batch;
import harvester.coordinator.model.Job;
import harvester.coordinator.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Job persistence.
 * Status updates are conditional so a job never moves backwards or leaves a
 * terminal state.
 */
public interface JobRepository {

    /**
     * Insert a job and all of its batches in one transaction.
     * Either every row exists afterwards or none does.
     *
     * @param job     the job, normally PENDING
     * @param batches its batches, normally PENDING
     */
    void createWithBatches(Job job, List<Batch> batches);

    Optional<Job> findById(String jobId);

    /**
     * All jobs, most recent first.
     */
    List<Job> findAll();

    List<Job> findByStatus(JobStatus status);

    List<Job> findByOwner(String owner);

    List<Job> findRecent(int limit);

    /**
     * Terminal jobs whose finishedAt is before the cutoff, oldest first.
     */
    List<Job> findFinishedBefore(Instant cutoff);

    /**
     * PENDING -> RUNNING, setting startedAt.
     *
     * @return true if this call made the transition
     */
    boolean markStarted(String jobId);

    /**
     * Non-terminal -> COMPLETED with the merged artifact location.
     *
     * @return true if this call made the transition
     */
    boolean markCompleted(String jobId, String finalArtifactRef);

    /**
     * Non-terminal -> FAILED.
     *
     * @param failedBatchIndex index of the batch that caused the failure, or null
     * @return true if this call made the transition
     */
    boolean markFailed(String jobId, String errorMessage, Integer failedBatchIndex);

    /**
     * Non-terminal -> CANCELLED.
     *
     * @return true if this call made the transition
     */
    boolean markCancelled(String jobId);

    /**
     * Generate a new unique Job ID like "job-{uuid}".
     */
    String generateId();
}
