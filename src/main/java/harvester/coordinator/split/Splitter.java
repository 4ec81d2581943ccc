package harvester.coordinator.split;

import harvester.coordinator.error.ValidationException;
import harvester.coordinator.model.BatchDescriptor;
import harvester.coordinator.model.SplitResult;
import harvester.coordinator.store.FragmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Partitions an ordered input stream into fixed-size batches.
 *
 * Rows keep their input order; batch indexes start at 0 and increase by one.
 * Every batch holds exactly batchSize rows except the last, which holds the
 * remainder. Each slice is streamed straight to its input fragment, so the full
 * input is never held in memory.
 */
public class Splitter {

    private static final Logger log = LoggerFactory.getLogger(Splitter.class);

    private final FragmentStore fragments;

    public Splitter(FragmentStore fragments) {
        this.fragments = fragments;
    }

    /**
     * Split the input and persist one fragment per batch.
     * On failure every fragment written so far is removed.
     *
     * @throws ValidationException if the input is empty, unreadable or holds a multi-line row,
     *         or batchSize is not positive
     */
    public SplitResult split(String jobId, InputSource input, int batchSize) {
        if (batchSize <= 0) {
            throw new ValidationException("batchSize must be positive, got " + batchSize);
        }

        List<BatchDescriptor> batches = new ArrayList<>();
        int totalRows = 0;
        int index = 0;
        int rowsInBatch = 0;
        BufferedWriter writer = null;

        try {
            String row;
            while ((row = input.nextRow()) != null) {
                if (row.indexOf('\n') >= 0 || row.indexOf('\r') >= 0) {
                    closeQuietly(writer);
                    fragments.deleteJob(jobId);
                    throw new ValidationException(
                            "Row " + (totalRows + 1) + " of " + input.describe() + " contains a line break");
                }
                if (writer == null) {
                    writer = fragments.openInputWriter(jobId, index);
                }
                writer.write(row);
                writer.newLine();
                rowsInBatch++;
                totalRows++;

                if (rowsInBatch == batchSize) {
                    writer.close();
                    writer = null;
                    batches.add(descriptor(jobId, index, rowsInBatch));
                    index++;
                    rowsInBatch = 0;
                }
            }
            if (writer != null) {
                writer.close();
                writer = null;
                batches.add(descriptor(jobId, index, rowsInBatch));
            }
        } catch (IOException e) {
            closeQuietly(writer);
            fragments.deleteJob(jobId);
            throw new ValidationException("Input is unreadable: " + input.describe(), e);
        }

        if (totalRows == 0) {
            fragments.deleteJob(jobId);
            throw new ValidationException("Input is empty: " + input.describe());
        }

        log.info("Split {} rows from {} into {} batches of up to {}",
                totalRows, input.describe(), batches.size(), batchSize);
        return new SplitResult(jobId, input.describe(), totalRows, batchSize, batches);
    }

    private BatchDescriptor descriptor(String jobId, int index, int rows) {
        return new BatchDescriptor(index, rows, fragments.inputFragment(jobId, index).toString());
    }

    private static void closeQuietly(BufferedWriter writer) {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (IOException e) {
            log.debug("Error closing fragment writer: {}", e.getMessage());
        }
    }
}
