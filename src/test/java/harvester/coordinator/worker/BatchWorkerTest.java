package harvester.coordinator.worker;

import com.fasterxml.jackson.databind.JsonNode;
import harvester.coordinator.TestPipeline;
import harvester.coordinator.extraction.ExtractionService;
import harvester.coordinator.extraction.PermanentExtractionException;
import harvester.coordinator.extraction.TransientExtractionException;
import harvester.coordinator.model.Batch;
import harvester.coordinator.model.BatchStatus;
import harvester.coordinator.model.Job;
import harvester.coordinator.model.JobStatus;
import harvester.coordinator.queue.BatchTask;
import harvester.coordinator.scheduler.ClaimReaper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BatchWorkerTest {

    @TempDir
    Path dataDir;

    private TestPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = TestPipeline.create(dataDir);
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    private BatchTask nextReady() {
        try {
            return pipeline.queue.poll(Duration.ZERO);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Test
    void transientFailuresAreRetriedUntilSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ExtractionService echo = pipeline.echo();
        ExtractionService flaky = (jobId, index, targets) -> {
            if (calls.incrementAndGet() <= 2) {
                throw new TransientExtractionException("scraper timed out");
            }
            return echo.extract(jobId, index, targets);
        };
        Job job = pipeline.submit(TestPipeline.targets(5), 10, 2);

        pipeline.drain(pipeline.worker("w1", flaky));

        Batch batch = pipeline.batches.findByJobIdAndIndex(job.id(), 0).orElseThrow();
        assertEquals(BatchStatus.COMPLETED, batch.status());
        assertEquals(3, batch.attemptCount());
        assertEquals(5, batch.recordCount());
        assertEquals(JobStatus.COMPLETED, pipeline.jobs.findById(job.id()).orElseThrow().status());
    }

    @Test
    void retriesStopAtTheCeiling() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ExtractionService down = (jobId, index, targets) -> {
            calls.incrementAndGet();
            throw new TransientExtractionException("connection refused");
        };
        Job job = pipeline.submit(TestPipeline.targets(5), 10, 2);

        pipeline.drain(pipeline.worker("w1", down));

        assertEquals(3, calls.get());
        Batch batch = pipeline.batches.findByJobIdAndIndex(job.id(), 0).orElseThrow();
        assertEquals(BatchStatus.FAILED, batch.status());
        assertEquals("connection refused", batch.lastError());

        Job failed = pipeline.jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(0, failed.failedBatchIndex());
    }

    @Test
    void permanentFailureFailsTheJobWithoutMerging() throws Exception {
        ExtractionService echo = pipeline.echo();
        ExtractionService rejectsSecond = (jobId, index, targets) -> {
            if (index == 1) {
                throw new PermanentExtractionException("target list rejected");
            }
            return echo.extract(jobId, index, targets);
        };
        Job job = pipeline.submit(TestPipeline.targets(30), 10, 2);

        pipeline.drain(pipeline.worker("w1", rejectsSecond));

        Job failed = pipeline.jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.status());
        assertEquals(1, failed.failedBatchIndex());
        assertNull(failed.finalArtifactRef());
        assertFalse(Files.exists(pipeline.fragments.finalArtifact(job.id())));

        Batch second = pipeline.batches.findByJobIdAndIndex(job.id(), 1).orElseThrow();
        assertEquals(BatchStatus.FAILED, second.status());
        assertEquals(1, second.attemptCount(), "permanent errors are not retried");

        Batch third = pipeline.batches.findByJobIdAndIndex(job.id(), 2).orElseThrow();
        assertEquals(BatchStatus.PENDING, third.status(), "queued work of a failed job is dropped");
    }

    @Test
    void unexpectedExtractionErrorsAreTransient() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ExtractionService echo = pipeline.echo();
        ExtractionService buggy = (jobId, index, targets) -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("parser bug");
            }
            return echo.extract(jobId, index, targets);
        };
        Job job = pipeline.submit(TestPipeline.targets(3), 10, 1);

        pipeline.drain(pipeline.worker("w1", buggy));

        assertEquals(JobStatus.COMPLETED, pipeline.jobs.findById(job.id()).orElseThrow().status());
    }

    @Test
    void fullRunMergesEveryRecordInOrder() throws Exception {
        List<String> rows = TestPipeline.targets(25_000);
        Job job = pipeline.submit(rows, 10_000, 2);
        assertEquals(3, job.totalBatches());

        pipeline.drain(pipeline.worker("w1", pipeline.echo()));

        Job done = pipeline.jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.status());
        assertNotNull(done.startedAt());
        assertNotNull(done.finishedAt());

        List<String> lines = Files.readAllLines(Path.of(done.finalArtifactRef()), StandardCharsets.UTF_8);
        assertEquals(25_000, lines.size());
        for (int i = 0; i < lines.size(); i += 997) {
            JsonNode record = pipeline.mapper.readTree(lines.get(i));
            assertEquals(rows.get(i), record.get("target").asText());
        }
        assertEquals(2, pipeline.mapper.readTree(lines.get(24_999)).get("batch").asInt());
    }

    @Test
    void taskForAnUnclaimableBatchIsSkipped() throws Exception {
        Job job = pipeline.submit(TestPipeline.targets(3), 10, 2);
        BatchTask task = pipeline.takeAll().get(0);
        pipeline.batches.claim(task.batchId(), "other-worker");

        assertEquals(BatchOutcome.SKIPPED, pipeline.worker("w1", pipeline.echo()).process(task));

        Batch batch = pipeline.batches.findById(task.batchId()).orElseThrow();
        assertEquals("other-worker", batch.claimedBy());
        assertEquals(JobStatus.PENDING, pipeline.jobs.findById(job.id()).orElseThrow().status());
    }

    @Test
    void duplicateDeliveryRunsTheBatchOnce() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ExtractionService echo = pipeline.echo();
        ExtractionService counting = (jobId, index, targets) -> {
            calls.incrementAndGet();
            return echo.extract(jobId, index, targets);
        };
        pipeline.submit(TestPipeline.targets(3), 10, 2);
        BatchTask task = pipeline.takeAll().get(0);
        BatchWorker worker = pipeline.worker("w1", counting);

        assertEquals(BatchOutcome.COMPLETED, worker.process(task));
        assertEquals(BatchOutcome.SKIPPED, worker.process(task));
        assertEquals(1, calls.get());
    }

    @Test
    void workerWhoseClaimWasReleasedCannotReplaceTheWinnersOutput() throws Exception {
        Job job = pipeline.submit(TestPipeline.targets(4), 2, 2);
        List<BatchTask> tasks = pipeline.takeAll();
        BatchWorker fast = pipeline.worker("fast", pipeline.echo());
        // Every claim counts as stuck, so the reaper releases "slow" while it is still extracting
        ClaimReaper reaper = new ClaimReaper(pipeline.batches, pipeline.queue, pipeline.jobService,
                Duration.ofSeconds(-1));
        List<BatchOutcome> winner = new ArrayList<>();

        ExtractionService stalls = (jobId, index, targets) -> {
            assertEquals(1, reaper.reapStuckClaims());
            winner.add(fast.process(nextReady()));
            List<JsonNode> late = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                late.add(pipeline.mapper.createObjectNode().put("target", "late-" + i));
            }
            return late;
        };

        assertEquals(BatchOutcome.SKIPPED, pipeline.worker("slow", stalls).process(tasks.get(0)));
        assertEquals(List.of(BatchOutcome.COMPLETED), winner);
        assertEquals(BatchOutcome.COMPLETED, fast.process(tasks.get(1)));

        Batch first = pipeline.batches.findByJobIdAndIndex(job.id(), 0).orElseThrow();
        assertEquals("fast", first.claimedBy());
        assertEquals(2, first.recordCount());
        assertEquals(2, pipeline.fragments.readOutput(first.outputRef(), 0).size());
        try (var files = Files.list(pipeline.fragments.outputDir(job.id()))) {
            assertEquals(1, files.filter(f -> f.getFileName().toString().startsWith("batch_0000")).count(),
                    "the refused attempt's fragment is discarded");
        }

        Job done = pipeline.jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.status());
        List<String> lines = Files.readAllLines(Path.of(done.finalArtifactRef()), StandardCharsets.UTF_8);
        assertEquals(4, lines.size());
        assertEquals("target-000000", pipeline.mapper.readTree(lines.get(0)).get("target").asText());
    }

    @Test
    void extractionReturningNoListFailsTheBatchPermanently() throws Exception {
        Job job = pipeline.submit(TestPipeline.targets(3), 10, 2);

        pipeline.drain(pipeline.worker("w1", (jobId, index, targets) -> null));

        Batch batch = pipeline.batches.findByJobIdAndIndex(job.id(), 0).orElseThrow();
        assertEquals(BatchStatus.FAILED, batch.status());
        assertEquals(1, batch.attemptCount());
        assertEquals(JobStatus.FAILED, pipeline.jobs.findById(job.id()).orElseThrow().status());
    }

    @Test
    void unexpectedErrorAfterTheClaimReturnsTheBatchToPending() throws Exception {
        Job job = pipeline.submit(TestPipeline.targets(3), 10, 2);
        BatchTask task = pipeline.takeAll().get(0);
        AtomicInteger claims = new AtomicInteger();
        BatchListener breaksOnce = new BatchListener() {
            @Override
            public void onBatchClaimed(Batch batch) {
                if (claims.incrementAndGet() == 1) {
                    throw new IllegalStateException("job row locked");
                }
                pipeline.jobService.onBatchClaimed(batch);
            }

            @Override
            public void onBatchCompleted(Batch batch) {
                pipeline.jobService.onBatchCompleted(batch);
            }

            @Override
            public void onBatchFailedPermanently(Batch batch, String error) {
                pipeline.jobService.onBatchFailedPermanently(batch, error);
            }
        };
        BatchWorker worker = new BatchWorker("w1", pipeline.queue, pipeline.batches, pipeline.fragments,
                pipeline.echo(), pipeline.retryPolicy, breaksOnce);

        assertEquals(BatchOutcome.RETRY_SCHEDULED, worker.process(task));

        Batch released = pipeline.batches.findById(task.batchId()).orElseThrow();
        assertEquals(BatchStatus.PENDING, released.status());
        assertNull(released.claimedBy());
        assertTrue(released.lastError().contains("job row locked"));

        pipeline.drain(worker);

        assertEquals(JobStatus.COMPLETED, pipeline.jobs.findById(job.id()).orElseThrow().status());
    }
}
