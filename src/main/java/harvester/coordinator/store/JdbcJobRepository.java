package harvester.coordinator.store;

import harvester.coordinator.model.Batch;
import harvester.coordinator.model.Job;
import harvester.coordinator.model.JobStatus;
import harvester.coordinator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of JobRepository.
 */
public class JdbcJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRepository.class);

    private static final String NON_TERMINAL = "status IN ('PENDING', 'RUNNING')";

    private final Database db;

    public JdbcJobRepository(Database db) {
        this.db = db;
    }

    @Override
    public void createWithBatches(Job job, List<Batch> batches) {
        String jobSql = """
                    INSERT INTO jobs (id, owner, status, input_ref, total_batches, total_rows, batch_size,
                                      webhook_url, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        String batchSql = """
                    INSERT INTO batches (id, job_id, batch_index, status, attempt_count, max_retries,
                                         row_count, input_ref, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement jobPs = conn.prepareStatement(jobSql);
                    PreparedStatement batchPs = conn.prepareStatement(batchSql)) {

                Timestamp now = Timestamp.from(job.createdAt() != null ? job.createdAt() : Instant.now());

                jobPs.setString(1, job.id());
                jobPs.setString(2, job.owner());
                jobPs.setString(3, job.status().name());
                jobPs.setString(4, job.inputRef());
                jobPs.setInt(5, job.totalBatches());
                jobPs.setInt(6, job.totalRows());
                jobPs.setInt(7, job.batchSize());
                jobPs.setString(8, job.webhookUrl());
                jobPs.setTimestamp(9, now);
                jobPs.executeUpdate();

                for (Batch batch : batches) {
                    batchPs.setString(1, batch.id());
                    batchPs.setString(2, batch.jobId());
                    batchPs.setInt(3, batch.index());
                    batchPs.setString(4, batch.status().name());
                    batchPs.setInt(5, batch.attemptCount());
                    batchPs.setInt(6, batch.maxRetries());
                    batchPs.setInt(7, batch.rowCount());
                    batchPs.setString(8, batch.inputRef());
                    batchPs.setTimestamp(9, now);
                    batchPs.addBatch();
                }
                if (!batches.isEmpty()) {
                    batchPs.executeBatch();
                }

                conn.commit();
                log.debug("Saved job {} with {} batches", job.id(), batches.size());
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create job: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findAll() {
        return query("SELECT * FROM jobs ORDER BY created_at DESC", null);
    }

    @Override
    public List<Job> findByStatus(JobStatus status) {
        return query("SELECT * FROM jobs WHERE status = ? ORDER BY created_at", status.name());
    }

    @Override
    public List<Job> findByOwner(String owner) {
        return query("SELECT * FROM jobs WHERE owner = ? ORDER BY created_at DESC", owner);
    }

    @Override
    public List<Job> findRecent(int limit) {
        String sql = "SELECT * FROM jobs ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find recent jobs", e);
        }
    }

    @Override
    public List<Job> findFinishedBefore(Instant cutoff) {
        String sql = """
                    SELECT * FROM jobs
                    WHERE status IN ('COMPLETED', 'FAILED', 'CANCELLED') AND finished_at < ?
                    ORDER BY finished_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find jobs finished before " + cutoff, e);
        }
    }

    @Override
    public boolean markStarted(String jobId) {
        String sql = """
                    UPDATE jobs
                    SET status = 'RUNNING', started_at = COALESCE(started_at, ?)
                    WHERE id = ? AND status = 'PENDING'
                """;

        boolean updated = update(sql, jobId, ps -> {
            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, jobId);
        });
        if (updated) {
            log.info("Job {} started", jobId);
        }
        return updated;
    }

    @Override
    public boolean markCompleted(String jobId, String finalArtifactRef) {
        String sql = "UPDATE jobs SET status = 'COMPLETED', final_artifact_ref = ?, finished_at = ? "
                + "WHERE id = ? AND " + NON_TERMINAL;

        return update(sql, jobId, ps -> {
            ps.setString(1, finalArtifactRef);
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, jobId);
        });
    }

    @Override
    public boolean markFailed(String jobId, String errorMessage, Integer failedBatchIndex) {
        String sql = "UPDATE jobs SET status = 'FAILED', error_message = ?, failed_batch_index = ?, finished_at = ? "
                + "WHERE id = ? AND " + NON_TERMINAL;

        return update(sql, jobId, ps -> {
            ps.setString(1, truncate(errorMessage));
            if (failedBatchIndex != null) {
                ps.setInt(2, failedBatchIndex);
            } else {
                ps.setNull(2, Types.INTEGER);
            }
            ps.setTimestamp(3, Timestamp.from(Instant.now()));
            ps.setString(4, jobId);
        });
    }

    @Override
    public boolean markCancelled(String jobId) {
        String sql = "UPDATE jobs SET status = 'CANCELLED', finished_at = ? WHERE id = ? AND " + NON_TERMINAL;

        return update(sql, jobId, ps -> {
            ps.setTimestamp(1, Timestamp.from(Instant.now()));
            ps.setString(2, jobId);
        });
    }

    @Override
    public String generateId() {
        return "job-" + UUID.randomUUID();
    }

    // Helper methods

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private boolean update(String sql, String jobId, Binder binder) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update job: " + jobId, e);
        }
    }

    private List<Job> query(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            if (param != null) {
                ps.setString(1, param);
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to query jobs", e);
        }
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        int failedIndex = rs.getInt("failed_batch_index");
        Integer failedBatchIndex = rs.wasNull() ? null : failedIndex;

        return Job.builder()
                .id(rs.getString("id"))
                .owner(rs.getString("owner"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .inputRef(rs.getString("input_ref"))
                .totalBatches(rs.getInt("total_batches"))
                .totalRows(rs.getInt("total_rows"))
                .batchSize(rs.getInt("batch_size"))
                .finalArtifactRef(rs.getString("final_artifact_ref"))
                .errorMessage(rs.getString("error_message"))
                .failedBatchIndex(failedBatchIndex)
                .webhookUrl(rs.getString("webhook_url"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .build();
    }

    static String truncate(String message) {
        if (message == null || message.length() <= 2048) {
            return message;
        }
        return message.substring(0, 2045) + "...";
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
