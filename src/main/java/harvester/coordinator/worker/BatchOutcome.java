package harvester.coordinator.worker;

/**
 * What a worker did with one dequeued task.
 */
public enum BatchOutcome {
    /** Claim refused: already completed, held elsewhere, exhausted, or job terminal */
    SKIPPED,
    /** Output written and batch completed */
    COMPLETED,
    /** Attempt failed; batch re-armed and re-enqueued after backoff */
    RETRY_SCHEDULED,
    /** Attempt failed and no attempts remain */
    FAILED
}
