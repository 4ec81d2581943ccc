package harvester.coordinator.worker;

import harvester.coordinator.model.Batch;

/**
 * Job-level reactions to batch state changes made by a worker.
 */
public interface BatchListener {

    /** A worker won the claim on a batch of this job. */
    void onBatchClaimed(Batch batch);

    /** A batch reached COMPLETED. */
    void onBatchCompleted(Batch batch);

    /** A batch reached terminal FAILED. */
    void onBatchFailedPermanently(Batch batch, String error);
}
