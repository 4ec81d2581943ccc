package harvester.coordinator.model;

/**
 * One slice of split input, before it is persisted as a {@link Batch}.
 *
 * @param index    0-based position, defines merge order
 * @param rowCount rows in this slice
 * @param inputRef location of the persisted input fragment
 */
public record BatchDescriptor(int index, int rowCount, String inputRef) {
}
