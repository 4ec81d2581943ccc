package harvester.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import harvester.coordinator.TestPipeline;
import harvester.coordinator.config.CoordinatorConfig;
import harvester.coordinator.config.Dependencies;
import harvester.coordinator.extraction.ExtractionService;
import harvester.coordinator.extraction.PermanentExtractionException;
import harvester.coordinator.server.CoordinatorServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the HTTP API end to end on an ephemeral port.
 */
class HttpEndpointIntegrationTest {

    @TempDir
    static Path dataDir;

    private static final ObjectMapper mapper = new ObjectMapper();
    private static final HttpClient http = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .build();

    private static Dependencies deps;
    private static CoordinatorServer server;
    private static String baseUrl;

    /** Echoes targets; a target starting with "bad" is rejected permanently. */
    private static final ExtractionService EXTRACTION = (jobId, batchIndex, targets) -> {
        List<JsonNode> records = new ArrayList<>();
        for (String target : targets) {
            if (target.startsWith("bad")) {
                throw new PermanentExtractionException("rejected target " + target);
            }
            records.add(mapper.createObjectNode().put("target", target));
        }
        return records;
    };

    @BeforeAll
    static void start() throws Exception {
        CoordinatorConfig config = CoordinatorConfig.defaults()
                .withDatabaseUrl(TestPipeline.inMemoryUrl("http"))
                .withServerHost("127.0.0.1")
                .withServerPort(0)
                .withDataDir(dataDir)
                .withWorkerCount(2)
                .withRetryBackoff(Duration.ZERO, Duration.ZERO);
        deps = Dependencies.create(config, EXTRACTION);
        deps.startWorkers();
        server = deps.server();
        server.start();
        baseUrl = "http://127.0.0.1:" + server.boundPort();
    }

    @AfterAll
    static void stop() {
        if (server != null) {
            server.stop();
        }
        if (deps != null) {
            deps.close();
        }
    }

    private static HttpResponse<String> get(String path) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(baseUrl + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private static HttpResponse<String> post(String path, String body) throws Exception {
        return http.send(HttpRequest.newBuilder(URI.create(baseUrl + path))
                        .header("Content-Type", "application/json")
                        .POST(HttpRequest.BodyPublishers.ofString(body))
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return mapper.readTree(response.body());
    }

    private static String statusOf(String jobId) throws Exception {
        return json(get("/api/v1/jobs/" + jobId)).get("status").asText();
    }

    @Test
    void submitPollAndInspect() throws Exception {
        HttpResponse<String> created = post("/api/v1/jobs",
                "{\"owner\":\"ana\",\"targets\":[\"a\",\"b\",\"c\",\"d\",\"e\"],\"batchSize\":2}");
        assertEquals(201, created.statusCode());
        String jobId = json(created).get("jobId").asText();
        assertEquals(3, json(created).get("totalBatches").asInt());

        await().atMost(Duration.ofSeconds(20)).until(() -> "COMPLETED".equals(statusOf(jobId)));

        JsonNode job = json(get("/api/v1/jobs/" + jobId));
        assertEquals(3, job.get("completedBatches").asInt());
        assertEquals(5, job.get("totalRows").asInt());
        assertEquals(5, Files.readAllLines(Path.of(job.get("finalArtifactRef").asText())).size());

        JsonNode batches = json(get("/api/v1/jobs/" + jobId + "/batches")).get("batches");
        assertEquals(3, batches.size());
        assertEquals(2, batches.get(2).get("index").asInt());

        JsonNode listed = json(get("/api/v1/jobs?owner=ana"));
        assertTrue(listed.get("count").asInt() >= 1);

        assertEquals(409, post("/api/v1/jobs/" + jobId + "/cancel", "").statusCode());
        assertEquals(0, json(post("/api/v1/jobs/" + jobId + "/resume", "")).get("enqueued").asInt());
    }

    @Test
    void failedSliceIsReportedAndCanBeRerun() throws Exception {
        HttpResponse<String> created = post("/api/v1/jobs",
                "{\"targets\":[\"a\",\"b\",\"bad-c\",\"d\"],\"batchSize\":2,\"maxRetries\":0}");
        String jobId = json(created).get("jobId").asText();

        await().atMost(Duration.ofSeconds(20)).until(() -> "FAILED".equals(statusOf(jobId)));

        JsonNode job = json(get("/api/v1/jobs/" + jobId));
        assertEquals(1, job.get("failedBatchIndex").asInt());
        assertFalse(job.has("finalArtifactRef"));

        HttpResponse<String> rerun = post("/api/v1/jobs/" + jobId + "/batches/1/rerun", "");
        assertEquals(201, rerun.statusCode());
        assertEquals(jobId, json(rerun).get("sourceJobId").asText());
    }

    @Test
    void invalidRequestsAreRejected() throws Exception {
        assertEquals(400, post("/api/v1/jobs", "{\"targets\":[]}").statusCode());
        assertEquals(400, post("/api/v1/jobs", "{not json").statusCode());
        assertEquals(400, post("/api/v1/jobs", "{\"targets\":[\"a\"],\"batchSize\":0}").statusCode());
        assertEquals(400, get("/api/v1/jobs?limit=zero").statusCode());
        assertEquals(404, get("/api/v1/jobs/job-missing").statusCode());
        assertEquals(404, get("/api/v1/nothing-here").statusCode());
    }

    @Test
    void healthReportsWorkers() throws Exception {
        HttpResponse<String> response = get("/api/v1/health");

        assertEquals(200, response.statusCode());
        assertEquals("healthy", json(response).get("status").asText());
        assertEquals(2, json(response).get("workers").asInt());
    }
}
