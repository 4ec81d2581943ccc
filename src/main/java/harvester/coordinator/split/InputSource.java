package harvester.coordinator.split;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;

/**
 * Normalized, ordered sequence of target identifiers supplied by an input
 * adapter. Rows are read once, front to back.
 */
public interface InputSource extends AutoCloseable {

    /**
     * @return the next row, or null when the input is exhausted
     * @throws IOException if the underlying input cannot be read
     */
    String nextRow() throws IOException;

    /**
     * Human-readable reference to where the input came from, persisted as the job's input_ref.
     */
    String describe();

    @Override
    void close() throws IOException;

    /**
     * In-memory source, e.g. targets posted in a request body.
     * Rows are trimmed; null and blank rows are skipped like blank lines of a file.
     */
    static InputSource of(String ref, List<String> rows) {
        Iterator<String> it = rows.iterator();
        return new InputSource() {
            @Override
            public String nextRow() {
                while (it.hasNext()) {
                    String row = it.next();
                    if (row != null && !row.isBlank()) {
                        return row.strip();
                    }
                }
                return null;
            }

            @Override
            public String describe() {
                return ref;
            }

            @Override
            public void close() {
            }
        };
    }
}
