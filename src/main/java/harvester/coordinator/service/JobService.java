package harvester.coordinator.service;

import harvester.coordinator.error.ValidationException;
import harvester.coordinator.model.Batch;
import harvester.coordinator.model.BatchDescriptor;
import harvester.coordinator.model.BatchStatus;
import harvester.coordinator.model.Job;
import harvester.coordinator.model.JobCounts;
import harvester.coordinator.model.JobStatus;
import harvester.coordinator.model.ProgressLedger;
import harvester.coordinator.model.SplitResult;
import harvester.coordinator.queue.BatchQueue;
import harvester.coordinator.queue.BatchTask;
import harvester.coordinator.repository.BatchRepository;
import harvester.coordinator.repository.JobRepository;
import harvester.coordinator.split.InputSource;
import harvester.coordinator.split.LineInputSource;
import harvester.coordinator.split.Splitter;
import harvester.coordinator.store.FragmentStore;
import harvester.coordinator.worker.BatchListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Business logic for Job management.
 * Handles submission, cancellation and the job-level reaction to batch
 * outcomes, including fail-fast on the first permanently failed batch.
 */
public class JobService implements BatchListener {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobRepository jobRepository;
    private final BatchRepository batchRepository;
    private final Splitter splitter;
    private final FragmentStore fragments;
    private final BatchQueue queue;
    private final Merger merger;
    private final CompletionNotifier notifier;

    public JobService(JobRepository jobRepository,
            BatchRepository batchRepository,
            Splitter splitter,
            FragmentStore fragments,
            BatchQueue queue,
            Merger merger,
            CompletionNotifier notifier) {
        this.jobRepository = jobRepository;
        this.batchRepository = batchRepository;
        this.splitter = splitter;
        this.fragments = fragments;
        this.queue = queue;
        this.merger = merger;
        this.notifier = notifier;
    }

    /**
     * Split the input, persist the job with all of its batches, and enqueue one
     * task per batch.
     *
     * @param owner      opaque requester identifier, may be null
     * @param input      ordered target identifiers
     * @param batchSize  rows per batch
     * @param maxRetries retries allowed per batch after the first attempt
     * @param webhookUrl notified when the job becomes terminal, may be null
     * @return the created job
     * @throws ValidationException if the input is empty or unreadable, or a parameter is out of range
     */
    public Job submit(String owner, InputSource input, int batchSize, int maxRetries, String webhookUrl) {
        if (maxRetries < 0) {
            throw new ValidationException("maxRetries must not be negative, got " + maxRetries);
        }

        String jobId = jobRepository.generateId();
        SplitResult split = splitter.split(jobId, input, batchSize);
        Instant now = Instant.now();

        Job job = Job.builder()
                .id(jobId)
                .owner(owner)
                .status(JobStatus.PENDING)
                .inputRef(split.inputRef())
                .totalBatches(split.totalBatches())
                .totalRows(split.totalRows())
                .batchSize(split.batchSize())
                .webhookUrl(webhookUrl)
                .createdAt(now)
                .build();

        List<Batch> batches = new ArrayList<>(split.totalBatches());
        for (BatchDescriptor descriptor : split.batches()) {
            batches.add(Batch.builder()
                    .id(UUID.randomUUID().toString())
                    .jobId(jobId)
                    .index(descriptor.index())
                    .status(BatchStatus.PENDING)
                    .attemptCount(0)
                    .maxRetries(maxRetries)
                    .rowCount(descriptor.rowCount())
                    .inputRef(descriptor.inputRef())
                    .createdAt(now)
                    .build());
        }

        try {
            jobRepository.createWithBatches(job, batches);
        } catch (RuntimeException e) {
            fragments.deleteJob(jobId);
            throw e;
        }
        log.info("Created job {} for {} with {} rows in {} batches",
                jobId, owner, split.totalRows(), batches.size());

        for (Batch batch : batches) {
            queue.enqueue(new BatchTask(jobId, batch.id(), batch.index()));
        }
        return job;
    }

    public Optional<Job> findById(String jobId) {
        return jobRepository.findById(jobId);
    }

    /**
     * All jobs, most recent first.
     */
    public List<Job> findAll() {
        return jobRepository.findAll();
    }

    public List<Job> findByOwner(String owner) {
        return jobRepository.findByOwner(owner);
    }

    public List<Job> findRecent(int limit) {
        return jobRepository.findRecent(limit);
    }

    /**
     * All batches of a job, by index.
     */
    public List<Batch> getBatches(String jobId) {
        return batchRepository.findByJobId(jobId);
    }

    public JobCounts counts(String jobId) {
        return batchRepository.countByJobId(jobId);
    }

    public Optional<ProgressLedger> ledger(String jobId) {
        return jobRepository.findById(jobId)
                .map(job -> new ProgressLedger(jobId, job.totalBatches(), batchRepository.findCompletedIds(jobId)));
    }

    /**
     * Cancel a non-terminal job. Queued tasks of the job are dropped and new
     * claims are refused; batches already claimed run to their own outcome.
     *
     * @return true if this call cancelled the job
     */
    public boolean cancel(String jobId) {
        Optional<Job> jobOpt = jobRepository.findById(jobId);
        if (jobOpt.isEmpty()) {
            return false;
        }
        if (jobOpt.get().isTerminal()) {
            log.warn("Cannot cancel job {} - already in terminal state: {}", jobId, jobOpt.get().status());
            return false;
        }

        if (!jobRepository.markCancelled(jobId)) {
            return false;
        }
        queue.cancelJob(jobId);
        log.info("Cancelled job {}", jobId);
        jobRepository.findById(jobId).ifPresent(notifier::notify);
        return true;
    }

    /**
     * Re-run one slice of a failed or cancelled job as a new job. The original
     * job stays terminal; its batch's input fragment becomes the new job's input.
     *
     * @return the new job, or empty if the job or batch does not exist
     * @throws ValidationException if the job is not FAILED or CANCELLED
     */
    public Optional<Job> rerunFailedSlice(String jobId, int batchIndex, int maxRetries) {
        Optional<Job> jobOpt = jobRepository.findById(jobId);
        if (jobOpt.isEmpty()) {
            return Optional.empty();
        }
        Job job = jobOpt.get();
        if (job.status() != JobStatus.FAILED && job.status() != JobStatus.CANCELLED) {
            throw new ValidationException("Job " + jobId + " is " + job.status() + ", only failed or cancelled jobs can be re-run");
        }

        Optional<Batch> batchOpt = batchRepository.findByJobIdAndIndex(jobId, batchIndex);
        if (batchOpt.isEmpty()) {
            return Optional.empty();
        }
        Batch batch = batchOpt.get();

        Job rerun;
        try (InputSource slice = LineInputSource.open(Path.of(batch.inputRef()))) {
            rerun = submit(job.owner(), slice, Math.max(batch.rowCount(), 1), maxRetries, job.webhookUrl());
        } catch (IOException e) {
            throw new ValidationException("Cannot read input fragment of batch " + batchIndex + " of job " + jobId, e);
        }
        log.info("Re-running batch {} of job {} as job {}", batchIndex, jobId, rerun.id());
        return Optional.of(rerun);
    }

    /**
     * Delete the batch fragments of terminal jobs that finished more than
     * {@code age} ago. Merged artifacts and the job and batch rows are kept,
     * so such a job's slices can no longer be re-run.
     *
     * @return number of jobs whose fragments were removed
     */
    public int cleanFinishedJobs(Duration age) {
        Instant cutoff = Instant.now().minus(age);
        int cleaned = 0;
        for (Job job : jobRepository.findFinishedBefore(cutoff)) {
            if (fragments.deleteFragments(job.id())) {
                log.debug("Removed fragments of {} job {}", job.status(), job.id());
                cleaned++;
            }
        }
        log.info("Removed fragments of {} jobs finished before {}", cleaned, cutoff);
        return cleaned;
    }

    // BatchListener

    @Override
    public void onBatchClaimed(Batch batch) {
        jobRepository.markStarted(batch.jobId());
    }

    @Override
    public void onBatchCompleted(Batch batch) {
        merger.tryFinalize(batch.jobId());
    }

    @Override
    public void onBatchFailedPermanently(Batch batch, String error) {
        String message = "Batch " + batch.index() + " failed after " + batch.attemptCount() + " attempts: " + error;
        if (!jobRepository.markFailed(batch.jobId(), message, batch.index())) {
            log.debug("Job {} already terminal, ignoring failure of batch {}", batch.jobId(), batch.index());
            return;
        }
        queue.cancelJob(batch.jobId());
        log.warn("Job {} failed: {}", batch.jobId(), message);
        jobRepository.findById(batch.jobId()).ifPresent(notifier::notify);
    }
}
