package harvester.coordinator.extraction;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * External scraper reached through a narrow contract: one batch of target
 * identifiers in, an ordered list of records out.
 * Implementations own their own rate limiting; the worker pool size only
 * bounds the number of concurrent calls.
 */
@FunctionalInterface
public interface ExtractionService {

    /**
     * Extract records for one batch.
     *
     * @param jobId      owning job (for correlation only)
     * @param batchIndex position of the batch within the job
     * @param targets    target identifiers, in input order
     * @return records in the order the service produced them; may be empty
     * @throws TransientExtractionException when the call may succeed if retried
     * @throws PermanentExtractionException when the batch content itself is bad
     */
    List<JsonNode> extract(String jobId, int batchIndex, List<String> targets) throws ExtractionException;
}
