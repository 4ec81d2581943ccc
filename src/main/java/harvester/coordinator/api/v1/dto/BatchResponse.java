package harvester.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import harvester.coordinator.model.Batch;

import java.time.Instant;

/**
 * Response DTO for one batch.
 * GET /api/v1/jobs/{jobId}/batches
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchResponse(
        @JsonProperty("batchId") String batchId,
        @JsonProperty("index") int index,
        @JsonProperty("status") String status,
        @JsonProperty("attemptCount") int attemptCount,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("rowCount") int rowCount,
        @JsonProperty("recordCount") Integer recordCount,
        @JsonProperty("outputRef") String outputRef,
        @JsonProperty("lastError") String lastError,
        @JsonProperty("claimedBy") String claimedBy,
        @JsonProperty("claimedAt") Instant claimedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    public static BatchResponse from(Batch batch) {
        return new BatchResponse(
                batch.id(),
                batch.index(),
                batch.status().name(),
                batch.attemptCount(),
                batch.maxRetries(),
                batch.rowCount(),
                batch.recordCount(),
                batch.outputRef(),
                batch.lastError(),
                batch.claimedBy(),
                batch.claimedAt(),
                batch.finishedAt());
    }
}
