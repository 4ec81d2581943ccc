package harvester.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model representing one slice of a job's input.
 * The index defines merge order; attempts are bounded by maxRetries + 1.
 */
public final class Batch {
    private final String id;
    private final String jobId;
    private final int index;
    private final BatchStatus status;
    private final int attemptCount;
    private final int maxRetries;
    private final int rowCount;
    private final String inputRef;
    private final String outputRef; // set on COMPLETED
    private final Integer recordCount;
    private final String lastError;
    private final String claimedBy;
    private final Instant claimedAt;
    private final Instant createdAt;
    private final Instant finishedAt;

    private Batch(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.index = builder.index;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.attemptCount = builder.attemptCount;
        this.maxRetries = builder.maxRetries;
        this.rowCount = builder.rowCount;
        this.inputRef = Objects.requireNonNull(builder.inputRef, "inputRef is required");
        this.outputRef = builder.outputRef;
        this.recordCount = builder.recordCount;
        this.lastError = builder.lastError;
        this.claimedBy = builder.claimedBy;
        this.claimedAt = builder.claimedAt;
        this.createdAt = builder.createdAt;
        this.finishedAt = builder.finishedAt;
    }

    public String id() {
        return id;
    }

    public String jobId() {
        return jobId;
    }

    public int index() {
        return index;
    }

    public BatchStatus status() {
        return status;
    }

    public int attemptCount() {
        return attemptCount;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public int rowCount() {
        return rowCount;
    }

    public String inputRef() {
        return inputRef;
    }

    public String outputRef() {
        return outputRef;
    }

    public Integer recordCount() {
        return recordCount;
    }

    public String lastError() {
        return lastError;
    }

    public String claimedBy() {
        return claimedBy;
    }

    public Instant claimedAt() {
        return claimedAt;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    /** Total attempts allowed: the first one plus maxRetries. */
    public int maxAttempts() {
        return maxRetries + 1;
    }

    /** Check if another attempt is allowed after the current one */
    public boolean canRetry() {
        return attemptCount < maxAttempts();
    }

    public boolean isTerminal() {
        return status == BatchStatus.COMPLETED || status == BatchStatus.FAILED;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .jobId(jobId)
                .index(index)
                .status(status)
                .attemptCount(attemptCount)
                .maxRetries(maxRetries)
                .rowCount(rowCount)
                .inputRef(inputRef)
                .outputRef(outputRef)
                .recordCount(recordCount)
                .lastError(lastError)
                .claimedBy(claimedBy)
                .claimedAt(claimedAt)
                .createdAt(createdAt)
                .finishedAt(finishedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String jobId;
        private int index;
        private BatchStatus status = BatchStatus.PENDING;
        private int attemptCount = 0;
        private int maxRetries = 2;
        private int rowCount;
        private String inputRef;
        private String outputRef;
        private Integer recordCount;
        private String lastError;
        private String claimedBy;
        private Instant claimedAt;
        private Instant createdAt;
        private Instant finishedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder index(int index) {
            this.index = index;
            return this;
        }

        public Builder status(BatchStatus status) {
            this.status = status;
            return this;
        }

        public Builder attemptCount(int attemptCount) {
            this.attemptCount = attemptCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder rowCount(int rowCount) {
            this.rowCount = rowCount;
            return this;
        }

        public Builder inputRef(String inputRef) {
            this.inputRef = inputRef;
            return this;
        }

        public Builder outputRef(String outputRef) {
            this.outputRef = outputRef;
            return this;
        }

        public Builder recordCount(Integer recordCount) {
            this.recordCount = recordCount;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder claimedBy(String claimedBy) {
            this.claimedBy = claimedBy;
            return this;
        }

        public Builder claimedAt(Instant claimedAt) {
            this.claimedAt = claimedAt;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Batch build() {
            return new Batch(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Batch batch))
            return false;
        return Objects.equals(id, batch.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Batch{id='" + id + "', index=" + index + ", status=" + status
                + ", attempts=" + attemptCount + "/" + maxAttempts() + "}";
    }
}
