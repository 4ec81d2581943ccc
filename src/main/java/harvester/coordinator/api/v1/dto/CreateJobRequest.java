package harvester.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import harvester.coordinator.error.ValidationException;

import java.util.List;
import java.util.Objects;

/**
 * Request DTO for submitting a job.
 * POST /api/v1/jobs
 *
 * Targets come either inline ({@code targets}) or from a text file readable by
 * the server ({@code inputPath}, one identifier per line), never both.
 * Unset numeric fields fall back to the configured defaults.
 */
public record CreateJobRequest(
        @JsonProperty("owner") String owner,
        @JsonProperty("targets") List<String> targets,
        @JsonProperty("inputPath") String inputPath,
        @JsonProperty("batchSize") Integer batchSize,
        @JsonProperty("maxRetries") Integer maxRetries,
        @JsonProperty("webhookUrl") String webhookUrl) {

    public boolean hasInlineTargets() {
        return targets != null;
    }

    public int batchSizeOr(int defaultBatchSize) {
        return batchSize != null ? batchSize : defaultBatchSize;
    }

    public int maxRetriesOr(int defaultMaxRetries) {
        return maxRetries != null ? maxRetries : defaultMaxRetries;
    }

    /** Validate the request */
    public void validate() {
        boolean inline = targets != null;
        boolean file = inputPath != null && !inputPath.isBlank();
        if (inline == file) {
            throw new ValidationException("exactly one of targets or inputPath is required");
        }
        if (inline && targets.isEmpty()) {
            throw new ValidationException("targets must not be empty");
        }
        if (inline && targets.stream().anyMatch(Objects::isNull)) {
            throw new ValidationException("targets must not contain null");
        }
        if (batchSize != null && batchSize <= 0) {
            throw new ValidationException("batchSize must be positive");
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new ValidationException("maxRetries must not be negative");
        }
        if (webhookUrl != null && !webhookUrl.isBlank()
                && !(webhookUrl.startsWith("http://") || webhookUrl.startsWith("https://"))) {
            throw new ValidationException("webhookUrl must be an http(s) URL");
        }
    }
}
