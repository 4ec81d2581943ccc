package harvester.coordinator.extraction;

/**
 * Recoverable failure: timeout, rate limit, transport error.
 */
public class TransientExtractionException extends ExtractionException {

    public TransientExtractionException(String message) {
        super(message);
    }

    public TransientExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
