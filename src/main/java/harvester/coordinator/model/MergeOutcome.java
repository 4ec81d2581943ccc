package harvester.coordinator.model;

/**
 * Result of an attempt to finalize a job.
 */
public enum MergeOutcome {
    /** Batches are still pending or claimed. */
    NOT_READY,
    /** All fragments merged, job moved to COMPLETED. */
    COMPLETED,
    /** A batch failed permanently or a fragment was corrupt, job moved to FAILED. */
    FAILED,
    /** Job was already terminal (another caller finalized it, or it was cancelled). */
    ALREADY_TERMINAL,
    /** Job does not exist. */
    NOT_FOUND
}
