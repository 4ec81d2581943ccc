package harvester.coordinator.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Extraction adapter for a scraper exposed over HTTP.
 *
 * Request: {@code POST <url>} with {@code {"jobId","batchIndex","targets":[...]}}.
 * Response: a JSON object holding a {@code records} (or {@code results}) array.
 *
 * 429, 5xx, timeouts and transport errors are transient; any other non-2xx
 * status and unparseable responses are permanent.
 */
public class HttpExtractionService implements ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(HttpExtractionService.class);

    private final URI endpoint;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public HttpExtractionService(String url, ObjectMapper mapper, Duration timeout) {
        this.endpoint = URI.create(url);
        this.mapper = mapper;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public List<JsonNode> extract(String jobId, int batchIndex, List<String> targets) throws ExtractionException {
        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .header("Content-Type", "application/json; charset=utf-8")
                    .timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody(jobId, batchIndex, targets),
                            StandardCharsets.UTF_8))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientExtractionException("Extraction timed out after " + timeout.toSeconds() + "s", e);
        } catch (IOException e) {
            throw new TransientExtractionException("Extraction service unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientExtractionException("Extraction interrupted", e);
        }

        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new TransientExtractionException("Extraction service returned HTTP " + status);
        }
        if (status < 200 || status >= 300) {
            throw new PermanentExtractionException(
                    "Extraction service rejected batch " + batchIndex + ": HTTP " + status + " " + abbreviate(response.body()));
        }

        List<JsonNode> records = parseRecords(response.body());
        log.debug("Extracted {} records for job {} batch {}", records.size(), jobId, batchIndex);
        return records;
    }

    private String requestBody(String jobId, int batchIndex, List<String> targets) throws PermanentExtractionException {
        ObjectNode body = mapper.createObjectNode();
        body.put("jobId", jobId);
        body.put("batchIndex", batchIndex);
        ArrayNode array = body.putArray("targets");
        targets.forEach(array::add);
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new PermanentExtractionException("Cannot serialize batch " + batchIndex, e);
        }
    }

    List<JsonNode> parseRecords(String body) throws PermanentExtractionException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PermanentExtractionException("Extraction response is not JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode array = null;
        if (root != null && root.isArray()) {
            array = root;
        } else if (root != null && root.isObject()) {
            array = root.has("records") ? root.get("records") : root.get("results");
        }
        if (array == null || !array.isArray()) {
            throw new PermanentExtractionException("Extraction response has no records array");
        }

        List<JsonNode> records = new ArrayList<>(array.size());
        array.forEach(records::add);
        return records;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 200 ? text : text.substring(0, 197) + "...";
    }
}
