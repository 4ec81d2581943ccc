package harvester.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing one dataset submission.
 * A job owns a fixed set of batches created together with it.
 */
public final class Job {
    private final String id;
    private final String owner;
    private final JobStatus status;
    private final String inputRef;
    private final int totalBatches;
    private final int totalRows;
    private final int batchSize;
    private final String finalArtifactRef; // set only when COMPLETED
    private final String errorMessage;
    private final Integer failedBatchIndex;
    private final String webhookUrl;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant finishedAt;

    private Job(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.owner = builder.owner;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.inputRef = Objects.requireNonNull(builder.inputRef, "inputRef is required");
        this.totalBatches = builder.totalBatches;
        this.totalRows = builder.totalRows;
        this.batchSize = builder.batchSize;
        this.finalArtifactRef = builder.finalArtifactRef;
        this.errorMessage = builder.errorMessage;
        this.failedBatchIndex = builder.failedBatchIndex;
        this.webhookUrl = builder.webhookUrl;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public String owner() {
        return owner;
    }

    public JobStatus status() {
        return status;
    }

    public String inputRef() {
        return inputRef;
    }

    public int totalBatches() {
        return totalBatches;
    }

    public int totalRows() {
        return totalRows;
    }

    public int batchSize() {
        return batchSize;
    }

    public String finalArtifactRef() {
        return finalArtifactRef;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public Integer failedBatchIndex() {
        return failedBatchIndex;
    }

    public String webhookUrl() {
        return webhookUrl;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean hasWebhook() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .owner(owner)
                .status(status)
                .inputRef(inputRef)
                .totalBatches(totalBatches)
                .totalRows(totalRows)
                .batchSize(batchSize)
                .finalArtifactRef(finalArtifactRef)
                .errorMessage(errorMessage)
                .failedBatchIndex(failedBatchIndex)
                .webhookUrl(webhookUrl)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String owner;
        private JobStatus status = JobStatus.PENDING;
        private String inputRef;
        private int totalBatches;
        private int totalRows;
        private int batchSize;
        private String finalArtifactRef;
        private String errorMessage;
        private Integer failedBatchIndex;
        private String webhookUrl;
        private Instant createdAt;
        private Instant startedAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder inputRef(String inputRef) {
            this.inputRef = inputRef;
            return this;
        }

        public Builder totalBatches(int totalBatches) {
            this.totalBatches = totalBatches;
            return this;
        }

        public Builder totalRows(int totalRows) {
            this.totalRows = totalRows;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder finalArtifactRef(String finalArtifactRef) {
            this.finalArtifactRef = finalArtifactRef;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder failedBatchIndex(Integer failedBatchIndex) {
            this.failedBatchIndex = failedBatchIndex;
            return this;
        }

        public Builder webhookUrl(String webhookUrl) {
            this.webhookUrl = webhookUrl;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(id, job.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Job{id='" + id + "', status=" + status + ", batches=" + totalBatches + "}";
    }
}
