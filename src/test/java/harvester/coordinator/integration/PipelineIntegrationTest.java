package harvester.coordinator.integration;

import com.fasterxml.jackson.databind.JsonNode;
import harvester.coordinator.TestPipeline;
import harvester.coordinator.extraction.ExtractionService;
import harvester.coordinator.extraction.TransientExtractionException;
import harvester.coordinator.model.Batch;
import harvester.coordinator.model.Job;
import harvester.coordinator.model.JobStatus;
import harvester.coordinator.worker.WorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs jobs through a multi-threaded worker pool against a shared queue.
 */
class PipelineIntegrationTest {

    @TempDir
    Path dataDir;

    private TestPipeline pipeline;
    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        pipeline = TestPipeline.create(dataDir);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.stop();
        }
        pipeline.close();
    }

    private void startPool(int size, ExtractionService extraction) {
        pool = new WorkerPool(size, "it", id -> pipeline.worker(id, extraction));
        pool.start();
    }

    private JobStatus statusOf(String jobId) {
        return pipeline.jobs.findById(jobId).orElseThrow().status();
    }

    @Test
    void concurrentWorkersProcessEachBatchOnce() throws Exception {
        Map<Integer, AtomicInteger> successes = new ConcurrentHashMap<>();
        ExtractionService echo = pipeline.echo();
        startPool(6, (jobId, index, targets) -> {
            List<JsonNode> records = echo.extract(jobId, index, targets);
            successes.computeIfAbsent(index, i -> new AtomicInteger()).incrementAndGet();
            return records;
        });

        Job job = pipeline.submit(TestPipeline.targets(2_000), 50, 2);
        // duplicate delivery of every task
        pipeline.resume.resume(job.id());

        await().atMost(Duration.ofSeconds(30)).until(() -> statusOf(job.id()) == JobStatus.COMPLETED);

        assertEquals(40, successes.size());
        assertTrue(successes.values().stream().allMatch(c -> c.get() == 1));
        assertTrue(pipeline.batches.findByJobId(job.id()).stream().allMatch(b -> b.attemptCount() == 1));

        Job done = pipeline.jobs.findById(job.id()).orElseThrow();
        List<String> lines = Files.readAllLines(Path.of(done.finalArtifactRef()));
        assertEquals(2_000, lines.size());
        assertEquals("target-001999", pipeline.mapper.readTree(lines.get(1_999)).get("target").asText());
    }

    @Test
    void flakyExtractionStillCompletes() {
        Map<Integer, AtomicInteger> attempts = new ConcurrentHashMap<>();
        ExtractionService echo = pipeline.echo();
        startPool(4, (jobId, index, targets) -> {
            int attempt = attempts.computeIfAbsent(index, i -> new AtomicInteger()).incrementAndGet();
            if (index % 3 == 0 && attempt < 3) {
                throw new TransientExtractionException("rate limited");
            }
            return echo.extract(jobId, index, targets);
        });

        Job job = pipeline.submit(TestPipeline.targets(300), 25, 2);

        await().atMost(Duration.ofSeconds(30)).until(() -> statusOf(job.id()) == JobStatus.COMPLETED);

        for (Batch batch : pipeline.batches.findByJobId(job.id())) {
            assertEquals(batch.index() % 3 == 0 ? 3 : 1, batch.attemptCount(), "batch " + batch.index());
        }
    }

    @Test
    void independentJobsProgressSideBySide() {
        startPool(4, pipeline.echo());

        Job first = pipeline.submit(TestPipeline.targets(500), 20, 2);
        Job second = pipeline.submit(TestPipeline.targets(120), 20, 2);
        Job cancelled = pipeline.submit(TestPipeline.targets(5), 20, 2);
        pipeline.jobService.cancel(cancelled.id());

        await().atMost(Duration.ofSeconds(30)).until(() ->
                statusOf(first.id()) == JobStatus.COMPLETED && statusOf(second.id()) == JobStatus.COMPLETED);

        assertEquals(JobStatus.CANCELLED, statusOf(cancelled.id()));
        assertNull(pipeline.jobs.findById(cancelled.id()).orElseThrow().finalArtifactRef());
    }
}
