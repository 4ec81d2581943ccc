package harvester.coordinator.store;

import harvester.coordinator.model.Batch;
import harvester.coordinator.model.BatchCompleteResult;
import harvester.coordinator.model.BatchFailResult;
import harvester.coordinator.model.BatchStatus;
import harvester.coordinator.model.JobCounts;
import harvester.coordinator.repository.BatchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC implementation of BatchRepository.
 * Claims are single conditional UPDATE statements: of two concurrent callers
 * for the same row, exactly one sees an update count of 1.
 */
public class JdbcBatchRepository implements BatchRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcBatchRepository.class);

    /** How many candidates claimNext inspects per round. */
    private static final int CLAIM_CANDIDATES = 8;

    private static final String CLAIM_SQL = """
                UPDATE batches
                SET status = 'CLAIMED', claimed_by = ?, claimed_at = ?, attempt_count = attempt_count + 1
                WHERE id = ?
                  AND status = 'PENDING'
                  AND attempt_count < max_retries + 1
                  AND EXISTS (SELECT 1 FROM jobs j WHERE j.id = batches.job_id AND j.status IN ('PENDING', 'RUNNING'))
            """;

    private final Database db;

    public JdbcBatchRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<Batch> findById(String batchId) {
        String sql = "SELECT * FROM batches WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, batchId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find batch: " + batchId, e);
        }
    }

    @Override
    public Optional<Batch> findByJobIdAndIndex(String jobId, int index) {
        String sql = "SELECT * FROM batches WHERE job_id = ? AND batch_index = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setInt(2, index);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find batch " + index + " of job " + jobId, e);
        }
    }

    @Override
    public List<Batch> findByJobId(String jobId) {
        String sql = "SELECT * FROM batches WHERE job_id = ? ORDER BY batch_index";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find batches for job: " + jobId, e);
        }
    }

    @Override
    public List<Batch> findOutstanding(String jobId) {
        String sql = """
                    SELECT * FROM batches
                    WHERE job_id = ? AND status IN ('PENDING', 'CLAIMED')
                    ORDER BY batch_index
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find outstanding batches for job: " + jobId, e);
        }
    }

    @Override
    public Set<String> findCompletedIds(String jobId) {
        String sql = "SELECT id FROM batches WHERE job_id = ? AND status = 'COMPLETED' ORDER BY batch_index";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            Set<String> ids = new LinkedHashSet<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString(1));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read progress ledger for job: " + jobId, e);
        }
    }

    @Override
    public JobCounts countByJobId(String jobId) {
        String sql = "SELECT status, COUNT(*) FROM batches WHERE job_id = ? GROUP BY status";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            int pending = 0, claimed = 0, completed = 0, failed = 0;
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int count = rs.getInt(2);
                    switch (BatchStatus.valueOf(rs.getString(1))) {
                        case PENDING -> pending = count;
                        case CLAIMED -> claimed = count;
                        case COMPLETED -> completed = count;
                        case FAILED -> failed = count;
                    }
                }
            }
            return new JobCounts(pending, claimed, completed, failed);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count batches for job: " + jobId, e);
        }
    }

    @Override
    public int countByStatus(BatchStatus status) {
        String sql = "SELECT COUNT(*) FROM batches WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count batches", e);
        }
    }

    @Override
    public Optional<Batch> claim(String batchId, String workerId) {
        try (Connection conn = db.getConnection()) {
            try {
                boolean claimed = tryClaim(conn, batchId, workerId);
                conn.commit();
                if (!claimed) {
                    return Optional.empty();
                }
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim batch: " + batchId, e);
        }

        log.debug("Batch {} claimed by {}", batchId, workerId);
        return findById(batchId);
    }

    @Override
    public Optional<Batch> claimNext(String jobId, String workerId) {
        String selectSql = """
                    SELECT id FROM batches
                    WHERE job_id = ? AND status = 'PENDING' AND attempt_count < max_retries + 1
                    ORDER BY batch_index
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                while (true) {
                    List<String> candidates = new ArrayList<>();
                    try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                        ps.setString(1, jobId);
                        ps.setInt(2, CLAIM_CANDIDATES);
                        try (ResultSet rs = ps.executeQuery()) {
                            while (rs.next()) {
                                candidates.add(rs.getString(1));
                            }
                        }
                    }
                    conn.commit();

                    if (candidates.isEmpty()) {
                        return Optional.empty();
                    }

                    for (String candidate : candidates) {
                        boolean claimed = tryClaim(conn, candidate, workerId);
                        conn.commit();
                        if (claimed) {
                            log.debug("Batch {} of job {} claimed by {}", candidate, jobId, workerId);
                            return findById(candidate);
                        }
                    }
                    // every candidate was taken by someone else; look again
                }
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim next batch for job: " + jobId, e);
        }
    }

    private boolean tryClaim(Connection conn, String batchId, String workerId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(CLAIM_SQL)) {
            ps.setString(1, workerId);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, batchId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public BatchCompleteResult complete(String batchId, String workerId, String outputRef, int recordCount) {
        Optional<Batch> batchOpt = findById(batchId);
        if (batchOpt.isEmpty()) {
            return BatchCompleteResult.NOT_FOUND;
        }

        Batch batch = batchOpt.get();

        if (batch.isTerminal()) {
            return BatchCompleteResult.ALREADY_DONE;
        }

        if (batch.claimedBy() != null && !workerId.equals(batch.claimedBy())) {
            log.warn("Worker {} tried to complete batch {} but it is claimed by {}",
                    workerId, batchId, batch.claimedBy());
            return BatchCompleteResult.WRONG_WORKER;
        }

        if (batch.status() != BatchStatus.CLAIMED) {
            log.warn("Batch {} is not CLAIMED (status: {}), refusing completion", batchId, batch.status());
            return BatchCompleteResult.WRONG_WORKER;
        }

        String sql = """
                    UPDATE batches
                    SET status = 'COMPLETED', output_ref = ?, record_count = ?, finished_at = ?, last_error = NULL
                    WHERE id = ? AND claimed_by = ? AND status = 'CLAIMED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, outputRef);
            ps.setInt(2, recordCount);
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.setString(4, batchId);
            ps.setString(5, workerId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                // Lost the claim between the read and the update
                return BatchCompleteResult.ALREADY_DONE;
            }

            log.debug("Batch {} completed by {} with {} records", batchId, workerId, recordCount);
            return BatchCompleteResult.COMPLETED;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete batch: " + batchId, e);
        }
    }

    @Override
    public BatchFailResult fail(String batchId, String workerId, String errorMessage, boolean retriable) {
        Optional<Batch> batchOpt = findById(batchId);
        if (batchOpt.isEmpty()) {
            return BatchFailResult.NOT_FOUND;
        }

        Batch batch = batchOpt.get();

        if (batch.isTerminal()) {
            return BatchFailResult.ALREADY_TERMINAL;
        }

        if (batch.claimedBy() != null && !workerId.equals(batch.claimedBy())) {
            log.warn("Worker {} tried to fail batch {} but it is claimed by {}", workerId, batchId, batch.claimedBy());
            return BatchFailResult.WRONG_WORKER;
        }

        if (batch.status() != BatchStatus.CLAIMED) {
            log.warn("Batch {} is not CLAIMED (status: {}), ignoring failure report", batchId, batch.status());
            return BatchFailResult.WRONG_WORKER;
        }

        boolean willRetry = retriable && batch.canRetry();

        String sql = willRetry
                ? """
                    UPDATE batches
                    SET status = 'PENDING', claimed_by = NULL, claimed_at = NULL, last_error = ?
                    WHERE id = ? AND claimed_by = ? AND status = 'CLAIMED'
                  """
                : """
                    UPDATE batches
                    SET status = 'FAILED', last_error = ?, finished_at = CURRENT_TIMESTAMP
                    WHERE id = ? AND claimed_by = ? AND status = 'CLAIMED'
                  """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, JdbcJobRepository.truncate(errorMessage));
            ps.setString(2, batchId);
            ps.setString(3, workerId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                return BatchFailResult.ALREADY_TERMINAL;
            }

            if (willRetry) {
                log.debug("Batch {} failed attempt {}/{}, re-armed", batchId, batch.attemptCount(),
                        batch.maxAttempts());
                return BatchFailResult.RETRIED;
            }
            log.debug("Batch {} permanently failed after {} attempts", batchId, batch.attemptCount());
            return BatchFailResult.FAILED;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record failure of batch: " + batchId, e);
        }
    }

    @Override
    public List<Batch> findStuckClaimed(Instant claimedBefore) {
        String sql = """
                    SELECT * FROM batches
                    WHERE status = 'CLAIMED' AND claimed_at < ?
                    ORDER BY claimed_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(claimedBefore));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stuck batches", e);
        }
    }

    @Override
    public boolean releaseClaim(String batchId, String workerId, String reason) {
        String sql = """
                    UPDATE batches
                    SET status = 'PENDING', claimed_by = NULL, claimed_at = NULL, last_error = ?
                    WHERE id = ? AND claimed_by = ? AND status = 'CLAIMED'
                """;
        return updateClaim(sql, batchId, workerId, reason);
    }

    @Override
    public boolean expireClaim(String batchId, String workerId, String reason) {
        String sql = """
                    UPDATE batches
                    SET status = 'FAILED', last_error = ?, finished_at = CURRENT_TIMESTAMP
                    WHERE id = ? AND claimed_by = ? AND status = 'CLAIMED'
                """;
        return updateClaim(sql, batchId, workerId, reason);
    }

    private boolean updateClaim(String sql, String batchId, String workerId, String reason) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, JdbcJobRepository.truncate(reason));
            ps.setString(2, batchId);
            ps.setString(3, workerId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update claim of batch: " + batchId, e);
        }
    }

    // Helper methods

    private List<Batch> executeQuery(PreparedStatement ps) throws SQLException {
        List<Batch> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Batch mapRow(ResultSet rs) throws SQLException {
        int recordCount = rs.getInt("record_count");
        Integer records = rs.wasNull() ? null : recordCount;

        return Batch.builder()
                .id(rs.getString("id"))
                .jobId(rs.getString("job_id"))
                .index(rs.getInt("batch_index"))
                .status(BatchStatus.valueOf(rs.getString("status")))
                .attemptCount(rs.getInt("attempt_count"))
                .maxRetries(rs.getInt("max_retries"))
                .rowCount(rs.getInt("row_count"))
                .inputRef(rs.getString("input_ref"))
                .outputRef(rs.getString("output_ref"))
                .recordCount(records)
                .lastError(rs.getString("last_error"))
                .claimedBy(rs.getString("claimed_by"))
                .claimedAt(toInstant(rs.getTimestamp("claimed_at")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
