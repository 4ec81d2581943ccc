package harvester.coordinator.model;

/**
 * Result of completing a batch.
 */
public enum BatchCompleteResult {
    /** Batch moved from CLAIMED to COMPLETED */
    COMPLETED,

    /** Batch was already terminal - idempotent success */
    ALREADY_DONE,

    /** Batch not found */
    NOT_FOUND,

    /** Batch is claimed by a different worker */
    WRONG_WORKER
}
