package harvester.coordinator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import harvester.coordinator.error.IntegrityException;
import harvester.coordinator.model.Batch;
import harvester.coordinator.model.BatchStatus;
import harvester.coordinator.model.Job;
import harvester.coordinator.model.JobCounts;
import harvester.coordinator.model.MergeOutcome;
import harvester.coordinator.repository.BatchRepository;
import harvester.coordinator.repository.JobRepository;
import harvester.coordinator.store.FragmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Finalizes a job once none of its batches can change state any more.
 *
 * A permanently failed batch fails the job without merging. Otherwise the
 * output fragments are concatenated in ascending batch index order into a JSON
 * Lines artifact. Empty fragments are skipped; a corrupt fragment aborts the
 * merge and fails the job, leaving all batch rows untouched.
 *
 * Safe to call concurrently and repeatedly: the artifact is moved into place
 * atomically and only one caller wins the job's terminal transition.
 */
public class Merger {

    private static final Logger log = LoggerFactory.getLogger(Merger.class);

    private final JobRepository jobRepository;
    private final BatchRepository batchRepository;
    private final FragmentStore fragments;
    private final ObjectMapper mapper;
    private final CompletionNotifier notifier;

    public Merger(JobRepository jobRepository,
            BatchRepository batchRepository,
            FragmentStore fragments,
            ObjectMapper mapper,
            CompletionNotifier notifier) {
        this.jobRepository = jobRepository;
        this.batchRepository = batchRepository;
        this.fragments = fragments;
        this.mapper = mapper;
        this.notifier = notifier;
    }

    public MergeOutcome tryFinalize(String jobId) {
        Optional<Job> jobOpt = jobRepository.findById(jobId);
        if (jobOpt.isEmpty()) {
            return MergeOutcome.NOT_FOUND;
        }
        if (jobOpt.get().isTerminal()) {
            return MergeOutcome.ALREADY_TERMINAL;
        }

        JobCounts counts = batchRepository.countByJobId(jobId);
        if (counts.outstanding() > 0) {
            log.debug("Job {} not ready to merge: {} batches outstanding", jobId, counts.outstanding());
            return MergeOutcome.NOT_READY;
        }

        List<Batch> batches = batchRepository.findByJobId(jobId);

        Optional<Batch> failed = batches.stream()
                .filter(b -> b.status() == BatchStatus.FAILED)
                .findFirst();
        if (failed.isPresent()) {
            Batch batch = failed.get();
            return fail(jobId, "Batch " + batch.index() + " failed: " + batch.lastError(), batch.index());
        }

        Path artifact = fragments.finalArtifact(jobId);
        long written;
        try {
            written = merge(jobId, batches, artifact);
        } catch (IntegrityException e) {
            log.error("Merge of job {} aborted at batch {}: {}", jobId, e.batchIndex(), e.getMessage());
            return fail(jobId, e.getMessage(), e.batchIndex());
        } catch (IOException e) {
            log.error("Cannot write merged artifact for job {}", jobId, e);
            return fail(jobId, "Cannot write merged artifact: " + e.getMessage(), null);
        }

        if (!jobRepository.markCompleted(jobId, artifact.toString())) {
            log.debug("Job {} was finalized by another caller", jobId);
            return MergeOutcome.ALREADY_TERMINAL;
        }

        log.info("Job {} completed: {} records from {} batches merged into {}",
                jobId, written, batches.size(), artifact);
        jobRepository.findById(jobId).ifPresent(notifier::notify);
        return MergeOutcome.COMPLETED;
    }

    /**
     * Write all fragments to a temp file, then move it over the artifact.
     *
     * @return number of records written
     */
    private long merge(String jobId, List<Batch> batches, Path artifact) throws IOException {
        Files.createDirectories(artifact.getParent());
        Path tmp = Files.createTempFile(artifact.getParent(), "result", ".jsonl.tmp");
        long written = 0;

        try {
            try (BufferedWriter out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                // findByJobId returns ascending index order
                for (Batch batch : batches) {
                    List<JsonNode> records = fragments.readOutput(batch.outputRef(), batch.index());
                    int recorded = batch.recordCount() != null ? batch.recordCount() : records.size();
                    if (records.size() != recorded) {
                        throw new IntegrityException(batch.index(), "Batch " + batch.index()
                                + " fragment holds " + records.size() + " records, expected " + recorded);
                    }
                    if (records.isEmpty()) {
                        log.info("Job {} batch {} produced no records, skipping", jobId, batch.index());
                        continue;
                    }
                    for (JsonNode record : records) {
                        out.write(mapper.writeValueAsString(record));
                        out.newLine();
                    }
                    written += records.size();
                }
            }
            fragments.moveIntoPlace(tmp, artifact);
        } finally {
            Files.deleteIfExists(tmp);
        }
        return written;
    }

    private MergeOutcome fail(String jobId, String error, Integer batchIndex) {
        if (!jobRepository.markFailed(jobId, error, batchIndex)) {
            return MergeOutcome.ALREADY_TERMINAL;
        }
        log.warn("Job {} failed: {}", jobId, error);
        jobRepository.findById(jobId).ifPresent(notifier::notify);
        return MergeOutcome.FAILED;
    }
}
