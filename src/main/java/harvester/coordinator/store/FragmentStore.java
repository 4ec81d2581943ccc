package harvester.coordinator.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import harvester.coordinator.error.IntegrityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import java.util.zip.CRC32;

/**
 * File-system storage for per-batch input and output fragments and the merged
 * artifact. Input locations are index-addressed under {@code <dataDir>/jobs/<jobId>/}
 * so a retry re-reads exactly the same slice.
 *
 * Output fragments are addressed by index, attempt and worker, so a worker
 * whose claim was released can never overwrite the fragment of the attempt
 * that completed the batch. They are JSON documents carrying a record count
 * and a CRC32 of the serialized records, checked again at merge time.
 */
public class FragmentStore {

    private static final Logger log = LoggerFactory.getLogger(FragmentStore.class);

    private final Path root;
    private final ObjectMapper mapper;

    public FragmentStore(Path dataDir, ObjectMapper mapper) {
        this.root = dataDir.resolve("jobs");
        this.mapper = mapper;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create fragment directory: " + root, e);
        }
    }

    public Path root() {
        return root;
    }

    public Path jobDir(String jobId) {
        return root.resolve(jobId);
    }

    public Path inputFragment(String jobId, int index) {
        return jobDir(jobId).resolve("input").resolve(fragmentName(index, ".txt"));
    }

    public Path outputDir(String jobId) {
        return jobDir(jobId).resolve("output");
    }

    public Path outputFragment(String jobId, int index, int attempt, String workerId) {
        String suffix = ".a" + attempt + "." + safeName(workerId) + ".json";
        return outputDir(jobId).resolve(fragmentName(index, suffix));
    }

    public Path finalArtifact(String jobId) {
        return jobDir(jobId).resolve("result.jsonl");
    }

    /**
     * Open a writer for a batch's input fragment, creating parent directories.
     */
    public BufferedWriter openInputWriter(String jobId, int index) throws IOException {
        Path path = inputFragment(jobId, index);
        Files.createDirectories(path.getParent());
        return Files.newBufferedWriter(path, StandardCharsets.UTF_8);
    }

    /**
     * Read the target identifiers of an input fragment, in order.
     */
    public List<String> readInput(String inputRef) throws IOException {
        List<String> targets = new ArrayList<>();
        for (String line : Files.readAllLines(Path.of(inputRef), StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                targets.add(line.strip());
            }
        }
        return targets;
    }

    /**
     * Write the output fragment of one attempt of a batch atomically.
     *
     * @param attempt the attempt number of the claim that produced the records
     * @param workerId the worker holding that claim
     * @return the fragment reference to store on the batch
     */
    public String writeOutput(String jobId, int index, int attempt, String workerId, List<JsonNode> records)
            throws IOException {
        ArrayNode array = mapper.createArrayNode();
        records.forEach(array::add);

        ObjectNode doc = mapper.createObjectNode();
        doc.put("jobId", jobId);
        doc.put("batchIndex", index);
        doc.put("recordCount", records.size());
        doc.put("checksum", checksum(array));
        doc.set("records", array);

        Path target = outputFragment(jobId, index, attempt, workerId);
        Files.createDirectories(target.getParent());
        writeAtomically(target, mapper.writeValueAsBytes(doc));
        return target.toString();
    }

    /**
     * Read and verify an output fragment.
     *
     * @return the records, empty if the fragment is empty
     * @throws IntegrityException if the fragment is missing, unparseable or fails its checks
     */
    public List<JsonNode> readOutput(String outputRef, int index) {
        if (outputRef == null) {
            throw new IntegrityException(index, "Batch " + index + " has no output fragment");
        }
        Path path = Path.of(outputRef);
        JsonNode doc;
        try {
            if (!Files.exists(path)) {
                throw new IntegrityException(index, "Output fragment missing: " + outputRef);
            }
            if (Files.size(path) == 0) {
                return List.of();
            }
            doc = mapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new IntegrityException(index, "Output fragment unreadable: " + outputRef, e);
        }

        JsonNode records = doc == null ? null : doc.get("records");
        if (records == null || !records.isArray()) {
            throw new IntegrityException(index, "Output fragment has no records array: " + outputRef);
        }
        int declared = doc.path("recordCount").asInt(-1);
        if (declared != records.size()) {
            throw new IntegrityException(index,
                    "Record count mismatch in " + outputRef + ": declared " + declared + ", found " + records.size());
        }
        String expected = doc.path("checksum").asText("");
        String actual = checksum((ArrayNode) records);
        if (!expected.equals(actual)) {
            throw new IntegrityException(index, "Checksum mismatch in " + outputRef);
        }

        List<JsonNode> result = new ArrayList<>(records.size());
        records.forEach(result::add);
        return result;
    }

    /**
     * Delete an output fragment that was never recorded on its batch.
     */
    public void discardOutput(String outputRef) {
        try {
            Files.deleteIfExists(Path.of(outputRef));
        } catch (IOException e) {
            log.warn("Could not delete unused fragment {}: {}", outputRef, e.getMessage());
        }
    }

    /**
     * Write bytes to a temp file next to the target, then move it into place.
     */
    public void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, bytes);
            moveIntoPlace(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Move a finished temp file over the target, atomically where supported.
     */
    public void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Remove everything stored for a job. Used when job creation is rolled back.
     */
    public void deleteJob(String jobId) {
        deleteTree(jobDir(jobId));
    }

    /**
     * Remove the input and output fragments of a finished job, keeping its
     * merged artifact.
     *
     * @return true if there was anything to remove
     */
    public boolean deleteFragments(String jobId) {
        Path input = jobDir(jobId).resolve("input");
        Path output = outputDir(jobId);
        boolean present = Files.exists(input) || Files.exists(output);
        deleteTree(input);
        deleteTree(output);
        return present;
    }

    private void deleteTree(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up {}: {}", dir, e.getMessage());
        }
    }

    private String checksum(ArrayNode records) {
        try {
            CRC32 crc = new CRC32();
            crc.update(mapper.writeValueAsBytes(records));
            return Long.toHexString(crc.getValue());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot serialize records", e);
        }
    }

    private static String safeName(String workerId) {
        return workerId.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    private static String fragmentName(int index, String suffix) {
        return String.format("batch_%04d%s", index, suffix);
    }
}
