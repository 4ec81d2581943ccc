package harvester.coordinator.extraction;

/**
 * Unrecoverable failure, e.g. malformed batch content.
 * Exhausts the batch's remaining attempts immediately.
 */
public class PermanentExtractionException extends ExtractionException {

    public PermanentExtractionException(String message) {
        super(message);
    }

    public PermanentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
