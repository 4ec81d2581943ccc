package harvester.coordinator.queue;

/**
 * A request to execute one batch. Carries no state beyond identity: the worker
 * must still win the claim in the store before doing anything.
 */
public record BatchTask(String jobId, String batchId, int batchIndex) {
}
