package harvester.coordinator.model;

/**
 * Result of failing a batch.
 */
public enum BatchFailResult {
    /** Batch returned to PENDING and may be claimed again */
    RETRIED,

    /** Batch failed permanently (ceiling reached or permanent error) */
    FAILED,

    /** Batch was already terminal - idempotent success */
    ALREADY_TERMINAL,

    /** Batch not found */
    NOT_FOUND,

    /** Batch is claimed by a different worker */
    WRONG_WORKER
}
