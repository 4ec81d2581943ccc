package harvester.coordinator.model;

import java.util.Set;

/**
 * Derived view of a job's progress: the ids of its completed batches.
 * Membership only grows; a completed batch never leaves the ledger.
 */
public record ProgressLedger(String jobId, int totalBatches, Set<String> completedBatchIds) {

    public ProgressLedger {
        completedBatchIds = Set.copyOf(completedBatchIds);
    }

    public boolean isCompleted(String batchId) {
        return completedBatchIds.contains(batchId);
    }

    public int completedCount() {
        return completedBatchIds.size();
    }

    public int remaining() {
        return totalBatches - completedBatchIds.size();
    }
}
