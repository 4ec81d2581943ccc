package harvester.coordinator.service;

import harvester.coordinator.model.Batch;
import harvester.coordinator.model.Job;
import harvester.coordinator.model.JobStatus;
import harvester.coordinator.queue.BatchQueue;
import harvester.coordinator.queue.BatchTask;
import harvester.coordinator.repository.BatchRepository;
import harvester.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Recomputes outstanding work from persisted batch state and re-enqueues it.
 * The queue is volatile; the store is not, so this is the crash-recovery path.
 *
 * Completed and terminally failed batches are never re-enqueued. Calling
 * {@link #resume(String)} on a job with nothing outstanding enqueues nothing.
 */
public class ResumeController {

    private static final Logger log = LoggerFactory.getLogger(ResumeController.class);

    private final JobRepository jobRepository;
    private final BatchRepository batchRepository;
    private final BatchQueue queue;
    private final Merger merger;

    public ResumeController(JobRepository jobRepository,
            BatchRepository batchRepository,
            BatchQueue queue,
            Merger merger) {
        this.jobRepository = jobRepository;
        this.batchRepository = batchRepository;
        this.queue = queue;
        this.merger = merger;
    }

    /**
     * Re-enqueue every PENDING or CLAIMED batch of a non-terminal job.
     * A job with no outstanding batches is handed to the merger instead.
     *
     * @return number of tasks enqueued
     */
    public int resume(String jobId) {
        Optional<Job> jobOpt = jobRepository.findById(jobId);
        if (jobOpt.isEmpty()) {
            log.warn("Cannot resume unknown job {}", jobId);
            return 0;
        }
        Job job = jobOpt.get();
        if (job.isTerminal()) {
            log.debug("Job {} is {}, nothing to resume", jobId, job.status());
            return 0;
        }

        List<Batch> outstanding = batchRepository.findOutstanding(jobId);
        if (outstanding.isEmpty()) {
            log.info("Job {} has no outstanding batches, finalizing", jobId);
            merger.tryFinalize(jobId);
            return 0;
        }

        for (Batch batch : outstanding) {
            queue.enqueue(new BatchTask(jobId, batch.id(), batch.index()));
        }
        log.info("Resumed job {}: {} of {} batches re-enqueued", jobId, outstanding.size(), job.totalBatches());
        return outstanding.size();
    }

    /**
     * Resume every PENDING or RUNNING job. Called at startup.
     *
     * @return total number of tasks enqueued
     */
    public int resumeAll() {
        int total = 0;
        int jobs = 0;
        for (JobStatus status : List.of(JobStatus.PENDING, JobStatus.RUNNING)) {
            for (Job job : jobRepository.findByStatus(status)) {
                try {
                    total += resume(job.id());
                    jobs++;
                } catch (RuntimeException e) {
                    log.error("Failed to resume job {}", job.id(), e);
                }
            }
        }
        if (jobs > 0) {
            log.info("Resumed {} jobs, {} batches re-enqueued", jobs, total);
        }
        return total;
    }
}
