package harvester.coordinator.error;

/**
 * A completed batch's output fragment is unreadable or fails its checksum.
 * Aborts the merge; batch state is left untouched for inspection.
 */
public class IntegrityException extends RuntimeException {

    private final int batchIndex;

    public IntegrityException(int batchIndex, String message) {
        super(message);
        this.batchIndex = batchIndex;
    }

    public IntegrityException(int batchIndex, String message, Throwable cause) {
        super(message, cause);
        this.batchIndex = batchIndex;
    }

    public int batchIndex() {
        return batchIndex;
    }
}
