package harvester.coordinator.service;

import harvester.coordinator.TestPipeline;
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

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ResumeControllerTest {

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

    private void completeDirectly(Batch batch) throws Exception {
        Batch claimed = pipeline.batches.claim(batch.id(), "crashed").orElseThrow();
        List<String> targets = pipeline.fragments.readInput(batch.inputRef());
        var records = pipeline.echo().extract(batch.jobId(), batch.index(), targets);
        String ref = pipeline.fragments.writeOutput(
                batch.jobId(), batch.index(), claimed.attemptCount(), "crashed", records);
        pipeline.batches.complete(batch.id(), "crashed", ref, records.size());
    }

    @Test
    void resumeEnqueuesOnlyIncompleteBatches() throws Exception {
        Job job = pipeline.submit(TestPipeline.targets(50), 10, 2);
        pipeline.takeAll(); // queue lost in the crash
        List<Batch> batches = pipeline.batches.findByJobId(job.id());
        completeDirectly(batches.get(0));
        completeDirectly(batches.get(3));
        pipeline.batches.claim(batches.get(4).id(), "crashed");

        int enqueued = pipeline.resume.resume(job.id());

        assertEquals(3, enqueued);
        Set<Integer> indexes = pipeline.takeAll().stream().map(BatchTask::batchIndex).collect(Collectors.toSet());
        assertEquals(Set.of(1, 2, 4), indexes);
    }

    @Test
    void resumedJobRunsToCompletionWithoutRepeatingWork() throws Exception {
        Job job = pipeline.submit(TestPipeline.targets(30), 10, 2);
        pipeline.takeAll();
        List<Batch> batches = pipeline.batches.findByJobId(job.id());
        completeDirectly(batches.get(0));
        pipeline.batches.claim(batches.get(2).id(), "crashed");

        pipeline.resume.resume(job.id());
        pipeline.drain(pipeline.worker("w2", pipeline.echo()));

        // the orphaned claim is only released once it goes stale
        assertEquals(BatchStatus.CLAIMED, pipeline.batches.findById(batches.get(2).id()).orElseThrow().status());
        Thread.sleep(20);
        new ClaimReaper(pipeline.batches, pipeline.queue, pipeline.jobService, Duration.ZERO).reapStuckClaims();
        pipeline.drain(pipeline.worker("w2", pipeline.echo()));

        Job done = pipeline.jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.status());
        assertEquals(1, pipeline.batches.findById(batches.get(0).id()).orElseThrow().attemptCount());
        assertEquals(2, pipeline.batches.findById(batches.get(2).id()).orElseThrow().attemptCount());
    }

    @Test
    void resumingACompletedJobIsANoOp() throws Exception {
        Job job = pipeline.submit(TestPipeline.targets(20), 10, 2);
        pipeline.drain(pipeline.worker("w1", pipeline.echo()));
        assertEquals(JobStatus.COMPLETED, pipeline.jobs.findById(job.id()).orElseThrow().status());

        assertEquals(0, pipeline.resume.resume(job.id()));
        assertEquals(0, pipeline.resume.resume(job.id()));
        assertEquals(0, pipeline.queue.size());
    }

    @Test
    void jobWithNothingOutstandingIsFinalized() throws Exception {
        Job job = pipeline.submit(TestPipeline.targets(20), 10, 2);
        pipeline.takeAll();
        for (Batch batch : pipeline.batches.findByJobId(job.id())) {
            completeDirectly(batch);
        }
        assertEquals(JobStatus.PENDING, pipeline.jobs.findById(job.id()).orElseThrow().status());

        assertEquals(0, pipeline.resume.resume(job.id()));

        Job done = pipeline.jobs.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, done.status());
        assertNotNull(done.finalArtifactRef());
    }

    @Test
    void unknownJobResumesNothing() {
        assertEquals(0, pipeline.resume.resume("job-missing"));
    }

    @Test
    void resumeAllCoversEveryOpenJob() throws Exception {
        Job first = pipeline.submit(TestPipeline.targets(20), 10, 2);
        Job second = pipeline.submit(TestPipeline.targets(5), 10, 2);
        Job cancelled = pipeline.submit(TestPipeline.targets(5), 10, 2);
        pipeline.jobService.cancel(cancelled.id());
        pipeline.takeAll();

        assertEquals(3, pipeline.resume.resumeAll());

        Set<String> jobIds = pipeline.takeAll().stream().map(BatchTask::jobId).collect(Collectors.toSet());
        assertEquals(Set.of(first.id(), second.id()), jobIds);
    }
}
