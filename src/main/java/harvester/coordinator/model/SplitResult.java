package harvester.coordinator.model;

import java.util.List;

/**
 * Output of splitting one input stream.
 */
public record SplitResult(String jobId, String inputRef, int totalRows, int batchSize,
        List<BatchDescriptor> batches) {

    public SplitResult {
        batches = List.copyOf(batches);
    }

    public int totalBatches() {
        return batches.size();
    }
}
