package harvester.coordinator.worker;

import harvester.coordinator.config.CoordinatorConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Backoff between attempts of one batch: {@code min(base * attempt, max)}.
 */
public final class RetryPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;

    public RetryPolicy(Duration baseDelay, Duration maxDelay) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("retry delays must not be negative");
        }
    }

    public static RetryPolicy from(CoordinatorConfig config) {
        return new RetryPolicy(config.retryBaseDelay(), config.retryMaxDelay());
    }

    /**
     * Delay before the attempt that follows the given (1-based) failed attempt.
     */
    public Duration delayFor(int failedAttempt) {
        if (failedAttempt <= 0) {
            return Duration.ZERO;
        }
        Duration delay = baseDelay.multipliedBy(failedAttempt);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    @Override
    public String toString() {
        return "RetryPolicy{base=" + baseDelay + ", max=" + maxDelay + "}";
    }
}
