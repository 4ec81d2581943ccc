package harvester.coordinator.error;

/**
 * Input rejected at split time (empty, unreadable or malformed).
 * No job or batch is persisted when this is thrown.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
