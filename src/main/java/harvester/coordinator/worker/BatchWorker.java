package harvester.coordinator.worker;

import com.fasterxml.jackson.databind.JsonNode;
import harvester.coordinator.extraction.ExtractionException;
import harvester.coordinator.extraction.ExtractionService;
import harvester.coordinator.extraction.PermanentExtractionException;
import harvester.coordinator.model.Batch;
import harvester.coordinator.model.BatchCompleteResult;
import harvester.coordinator.model.BatchFailResult;
import harvester.coordinator.queue.BatchQueue;
import harvester.coordinator.queue.BatchTask;
import harvester.coordinator.repository.BatchRepository;
import harvester.coordinator.store.FragmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A single batch worker.
 * Loops: take task → claim → read fragment → extract → complete or fail.
 * A failed attempt that may be retried is re-enqueued with a delay instead of
 * sleeping, so the worker is free for other batches meanwhile.
 * Stops cleanly on Thread.interrupt().
 */
public final class BatchWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BatchWorker.class);

    private final String workerId;
    private final BatchQueue queue;
    private final BatchRepository batches;
    private final FragmentStore fragments;
    private final ExtractionService extraction;
    private final RetryPolicy retryPolicy;
    private final BatchListener listener;

    public BatchWorker(String workerId,
            BatchQueue queue,
            BatchRepository batches,
            FragmentStore fragments,
            ExtractionService extraction,
            RetryPolicy retryPolicy,
            BatchListener listener) {
        this.workerId = workerId;
        this.queue = queue;
        this.batches = batches;
        this.fragments = fragments;
        this.extraction = extraction;
        this.retryPolicy = retryPolicy;
        this.listener = listener;
    }

    public String workerId() {
        return workerId;
    }

    @Override
    public void run() {
        Thread.currentThread().setName("worker-" + workerId);
        log.info("Worker {} started", workerId);

        while (!Thread.currentThread().isInterrupted()) {
            try {
                BatchTask task = queue.take();
                process(task);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Worker {} error", workerId, e);
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        log.info("Worker {} stopped", workerId);
    }

    /**
     * Execute one attempt of the task's batch.
     * Once the claim is won the batch never stays CLAIMED because this worker threw.
     */
    public BatchOutcome process(BatchTask task) {
        Optional<Batch> claimed = batches.claim(task.batchId(), workerId);
        if (claimed.isEmpty()) {
            log.debug("Worker {} skipped batch {} of job {} (not claimable)",
                    workerId, task.batchIndex(), task.jobId());
            return BatchOutcome.SKIPPED;
        }

        Batch batch = claimed.get();
        BatchOutcome outcome;
        try {
            outcome = attempt(task, batch);
        } catch (RuntimeException e) {
            log.error("Worker {} failed on job {} batch {} unexpectedly",
                    workerId, batch.jobId(), batch.index(), e);
            return handleFailure(task, batch, "Unexpected error: " + e, true);
        }

        if (outcome == BatchOutcome.COMPLETED) {
            try {
                listener.onBatchCompleted(batch);
            } catch (RuntimeException e) {
                // The batch stays COMPLETED; resume finalizes the job later
                log.error("Job {} could not react to completion of batch {}", batch.jobId(), batch.index(), e);
            }
        }
        return outcome;
    }

    private BatchOutcome attempt(BatchTask task, Batch batch) {
        listener.onBatchClaimed(batch);
        log.info("Job {} batch {} attempt {}/{} on worker {}",
                batch.jobId(), batch.index(), batch.attemptCount(), batch.maxAttempts(), workerId);

        List<String> targets;
        try {
            targets = fragments.readInput(batch.inputRef());
        } catch (IOException e) {
            return handleFailure(task, batch, "Cannot read input fragment: " + e.getMessage(), true);
        }

        List<JsonNode> records;
        try {
            records = extraction.extract(batch.jobId(), batch.index(), targets);
            if (records == null) {
                throw new PermanentExtractionException("Extraction returned no record list");
            }
        } catch (ExtractionException e) {
            return handleFailure(task, batch, e.getMessage(), e.isRetriable());
        } catch (RuntimeException e) {
            log.error("Extraction of job {} batch {} threw unexpectedly", batch.jobId(), batch.index(), e);
            return handleFailure(task, batch, "Unexpected extraction error: " + e, true);
        }

        String outputRef;
        try {
            outputRef = fragments.writeOutput(
                    batch.jobId(), batch.index(), batch.attemptCount(), workerId, records);
        } catch (IOException e) {
            return handleFailure(task, batch, "Cannot write output fragment: " + e.getMessage(), true);
        }

        BatchCompleteResult result = batches.complete(batch.id(), workerId, outputRef, records.size());
        if (result != BatchCompleteResult.COMPLETED) {
            log.warn("Worker {} could not complete batch {} of job {}: {}",
                    workerId, batch.index(), batch.jobId(), result);
            fragments.discardOutput(outputRef);
            return BatchOutcome.SKIPPED;
        }

        log.info("Job {} batch {} completed with {} records", batch.jobId(), batch.index(), records.size());
        return BatchOutcome.COMPLETED;
    }

    private BatchOutcome handleFailure(BatchTask task, Batch batch, String error, boolean retriable) {
        BatchFailResult result = batches.fail(batch.id(), workerId, error, retriable);

        switch (result) {
            case RETRIED -> {
                Duration delay = retryPolicy.delayFor(batch.attemptCount());
                log.warn("Job {} batch {} failed attempt {}/{} ({}), retrying in {}s",
                        batch.jobId(), batch.index(), batch.attemptCount(), batch.maxAttempts(), error,
                        delay.toSeconds());
                queue.enqueueAfter(task, delay);
                return BatchOutcome.RETRY_SCHEDULED;
            }
            case FAILED -> {
                log.error("Job {} batch {} failed permanently after {} attempts: {}",
                        batch.jobId(), batch.index(), batch.attemptCount(), error);
                listener.onBatchFailedPermanently(batch, error);
                return BatchOutcome.FAILED;
            }
            default -> {
                log.warn("Worker {} could not record failure of batch {} of job {}: {}",
                        workerId, batch.index(), batch.jobId(), result);
                return BatchOutcome.SKIPPED;
            }
        }
    }
}
