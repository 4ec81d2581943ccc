package harvester.coordinator.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import harvester.coordinator.error.IntegrityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FragmentStoreTest {

    @TempDir
    Path dataDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private FragmentStore store;

    @BeforeEach
    void setUp() {
        store = new FragmentStore(dataDir, mapper);
    }

    private List<JsonNode> records(int count) {
        return java.util.stream.IntStream.range(0, count)
                .mapToObj(i -> (JsonNode) mapper.createObjectNode().put("id", i))
                .toList();
    }

    @Test
    void fragmentsAreIndexAddressed() {
        assertEquals(dataDir.resolve("jobs/job-1/input/batch_0007.txt"), store.inputFragment("job-1", 7));
        assertEquals(dataDir.resolve("jobs/job-1/output/batch_0007.a2.node_a-1.json"),
                store.outputFragment("job-1", 7, 2, "node/a-1"));
        assertEquals(dataDir.resolve("jobs/job-1/result.jsonl"), store.finalArtifact("job-1"));
    }

    @Test
    void writtenOutputReadsBackVerified() throws Exception {
        String ref = store.writeOutput("job-1", 0, 1, "w1", records(3));

        List<JsonNode> read = store.readOutput(ref, 0);

        assertEquals(3, read.size());
        assertEquals(2, read.get(2).get("id").asInt());
        JsonNode doc = mapper.readTree(Path.of(ref).toFile());
        assertEquals(3, doc.get("recordCount").asInt());
        assertFalse(doc.get("checksum").asText().isEmpty());
    }

    @Test
    void zeroLengthFragmentIsEmptyNotCorrupt() throws Exception {
        Path path = store.outputFragment("job-1", 0, 1, "w1");
        Files.createDirectories(path.getParent());
        Files.createFile(path);

        assertTrue(store.readOutput(path.toString(), 0).isEmpty());
    }

    @Test
    void tamperedRecordsFailChecksum() throws Exception {
        String ref = store.writeOutput("job-1", 1, 1, "w1", records(2));
        ObjectNode doc = (ObjectNode) mapper.readTree(Path.of(ref).toFile());
        ((ObjectNode) doc.get("records").get(0)).put("id", 99);
        Files.write(Path.of(ref), mapper.writeValueAsBytes(doc));

        IntegrityException e = assertThrows(IntegrityException.class, () -> store.readOutput(ref, 1));
        assertEquals(1, e.batchIndex());
        assertTrue(e.getMessage().contains("Checksum"));
    }

    @Test
    void countMismatchIsCorrupt() throws Exception {
        String ref = store.writeOutput("job-1", 0, 1, "w1", records(2));
        ObjectNode doc = (ObjectNode) mapper.readTree(Path.of(ref).toFile());
        doc.put("recordCount", 5);
        Files.write(Path.of(ref), mapper.writeValueAsBytes(doc));

        assertThrows(IntegrityException.class, () -> store.readOutput(ref, 0));
    }

    @Test
    void unparseableOrMissingFragmentIsCorrupt() throws Exception {
        Path path = store.outputFragment("job-1", 2, 1, "w1");
        Files.createDirectories(path.getParent());
        Files.writeString(path, "{\"records\": [1, 2");

        assertThrows(IntegrityException.class, () -> store.readOutput(path.toString(), 2));
        assertThrows(IntegrityException.class, () -> store.readOutput(dataDir.resolve("nope.json").toString(), 3));
        assertThrows(IntegrityException.class, () -> store.readOutput(null, 4));
    }

    @Test
    void rewritingAFragmentReplacesIt() throws Exception {
        store.writeOutput("job-1", 0, 1, "w1", records(5));
        String ref = store.writeOutput("job-1", 0, 1, "w1", records(1));

        assertEquals(1, store.readOutput(ref, 0).size());
        try (var files = Files.list(Path.of(ref).getParent())) {
            assertEquals(1, files.count(), "no temp files left behind");
        }
    }

    @Test
    void attemptsOfOneBatchKeepSeparateFragments() throws Exception {
        String released = store.writeOutput("job-1", 0, 1, "slow", records(3));
        String winner = store.writeOutput("job-1", 0, 2, "fast", records(2));

        assertNotEquals(released, winner);
        assertEquals(2, store.readOutput(winner, 0).size());

        store.discardOutput(released);

        assertFalse(Files.exists(Path.of(released)));
        assertEquals(2, store.readOutput(winner, 0).size());
    }

    @Test
    void deleteFragmentsKeepsTheMergedArtifact() throws Exception {
        try (var writer = store.openInputWriter("job-1", 0)) {
            writer.write("a\n");
        }
        store.writeOutput("job-1", 0, 1, "w1", records(1));
        Files.writeString(store.finalArtifact("job-1"), "{\"id\":0}\n");

        assertTrue(store.deleteFragments("job-1"));

        assertFalse(Files.exists(store.inputFragment("job-1", 0)));
        assertFalse(Files.exists(store.outputDir("job-1")));
        assertTrue(Files.exists(store.finalArtifact("job-1")));
        assertFalse(store.deleteFragments("job-1"), "nothing left to remove");
    }

    @Test
    void deleteJobRemovesEverything() throws Exception {
        try (var writer = store.openInputWriter("job-1", 0)) {
            writer.write("a\n");
        }
        store.writeOutput("job-1", 0, 1, "w1", records(1));

        store.deleteJob("job-1");

        assertFalse(Files.exists(store.jobDir("job-1")));
    }
}
