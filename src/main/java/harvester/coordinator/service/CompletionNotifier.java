package harvester.coordinator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import harvester.coordinator.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Posts a job's terminal state to its webhook, if it has one.
 * Delivery is best effort: failures are logged and never change job state.
 */
public class CompletionNotifier {

    private static final Logger log = LoggerFactory.getLogger(CompletionNotifier.class);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public CompletionNotifier(ObjectMapper mapper, Duration timeout) {
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .build();
        this.mapper = mapper;
        this.timeout = timeout;
    }

    /**
     * @return true if the webhook answered 2xx; false if there is no webhook or delivery failed
     */
    public boolean notify(Job job) {
        if (!job.hasWebhook()) {
            return false;
        }

        String url = job.webhookUrl();
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Content-Type", "application/json; charset=utf-8")
                    .timeout(timeout)
                    .POST(HttpRequest.BodyPublishers.ofString(
                            mapper.writeValueAsString(payload(job)), StandardCharsets.UTF_8))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int statusCode = response.statusCode();
            if (statusCode >= 200 && statusCode < 300) {
                log.info("Notified {} of job {} ({})", url, job.id(), job.status());
                return true;
            }
            log.warn("Webhook {} rejected job {} notification: HTTP {}", url, job.id(), statusCode);
            return false;
        } catch (IOException e) {
            log.warn("Webhook {} unreachable for job {}: {}", url, job.id(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Webhook notification for job {} interrupted", job.id());
            return false;
        } catch (IllegalArgumentException e) {
            log.warn("Invalid webhook URL {} on job {}", url, job.id());
            return false;
        }
    }

    ObjectNode payload(Job job) {
        ObjectNode body = mapper.createObjectNode();
        body.put("jobId", job.id());
        body.put("status", job.status().name());
        body.put("finalArtifactRef", job.finalArtifactRef());
        if (job.failedBatchIndex() != null) {
            body.put("failedBatchIndex", job.failedBatchIndex());
        } else {
            body.putNull("failedBatchIndex");
        }
        body.put("error", job.errorMessage());
        return body;
    }
}
