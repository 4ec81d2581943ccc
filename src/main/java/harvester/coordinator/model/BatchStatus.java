package harvester.coordinator.model;

/**
 * Batch execution status.
 */
public enum BatchStatus {
    /** Waiting to be claimed (first attempt or re-armed after a transient failure) */
    PENDING,
    /** Held by exactly one worker */
    CLAIMED,
    /** Output fragment written */
    COMPLETED,
    /** Retries exhausted or permanent error; never claimed again */
    FAILED
}
