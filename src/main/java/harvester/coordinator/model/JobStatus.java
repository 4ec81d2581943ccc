package harvester.coordinator.model;

/**
 * Job status representing the overall state of a scrape job.
 * Transitions only move forward: PENDING -> RUNNING -> {COMPLETED, FAILED},
 * with CANCELLED reachable from either non-terminal state.
 */
public enum JobStatus {
    /** Job created, no batch claimed yet */
    PENDING,
    /** At least one batch has been claimed */
    RUNNING,
    /** All batches completed and the merged artifact is written */
    COMPLETED,
    /** A batch failed permanently, or the merge found a corrupt fragment */
    FAILED,
    /** Job cancelled by an operator */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
