package harvester.coordinator.model;

/**
 * Batch counts per status for one job.
 */
public record JobCounts(int pending, int claimed, int completed, int failed) {

    public int total() {
        return pending + claimed + completed + failed;
    }

    /** Batches that may still change state. */
    public int outstanding() {
        return pending + claimed;
    }
}
