package harvester.coordinator.extraction;

/**
 * Failure reported by an {@link ExtractionService}.
 */
public abstract class ExtractionException extends Exception {

    protected ExtractionException(String message) {
        super(message);
    }

    protected ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether another attempt of the same batch may succeed. */
    public abstract boolean isRetriable();
}
