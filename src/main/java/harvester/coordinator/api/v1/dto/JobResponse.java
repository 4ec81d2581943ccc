package harvester.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import harvester.coordinator.model.Job;
import harvester.coordinator.model.JobCounts;

import java.time.Instant;

/**
 * Response DTO for job details.
 * GET /api/v1/jobs/{jobId}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        @JsonProperty("jobId") String jobId,
        @JsonProperty("owner") String owner,
        @JsonProperty("status") String status,
        @JsonProperty("inputRef") String inputRef,
        @JsonProperty("totalBatches") int totalBatches,
        @JsonProperty("totalRows") int totalRows,
        @JsonProperty("batchSize") int batchSize,
        @JsonProperty("pendingBatches") Integer pendingBatches,
        @JsonProperty("claimedBatches") Integer claimedBatches,
        @JsonProperty("completedBatches") Integer completedBatches,
        @JsonProperty("failedBatches") Integer failedBatches,
        @JsonProperty("finalArtifactRef") String finalArtifactRef,
        @JsonProperty("failedBatchIndex") Integer failedBatchIndex,
        @JsonProperty("error") String error,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("finishedAt") Instant finishedAt) {

    /** Compact version for list responses */
    public static JobResponse from(Job job) {
        return from(job, null);
    }

    /** Create response with batch counters */
    public static JobResponse from(Job job, JobCounts counts) {
        return new JobResponse(
                job.id(),
                job.owner(),
                job.status().name(),
                job.inputRef(),
                job.totalBatches(),
                job.totalRows(),
                job.batchSize(),
                counts != null ? counts.pending() : null,
                counts != null ? counts.claimed() : null,
                counts != null ? counts.completed() : null,
                counts != null ? counts.failed() : null,
                job.finalArtifactRef(),
                job.failedBatchIndex(),
                job.errorMessage(),
                job.createdAt(),
                job.startedAt(),
                job.finishedAt());
    }
}
