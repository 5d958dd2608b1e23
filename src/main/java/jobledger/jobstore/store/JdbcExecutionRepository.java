package jobledger.jobstore.store;

import jobledger.jobstore.exception.JobStoreException;
import jobledger.jobstore.model.ExecutionRecord;
import jobledger.jobstore.model.ExecutionStatus;
import jobledger.jobstore.model.TriggerKind;
import jobledger.jobstore.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.function.UnaryOperator;

import static jobledger.jobstore.store.JdbcJobRecordRepository.setTimestamp;
import static jobledger.jobstore.store.JdbcJobRecordRepository.toInstant;

/**
 * JDBC implementation of ExecutionRepository.
 * Row-level {@code SELECT ... FOR UPDATE} serializes concurrent writers of the
 * same job's record.
 */
public class JdbcExecutionRepository implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionRepository.class);

    /** Width of the {@code exception} column */
    static final int EXCEPTION_MAX_LENGTH = 1000;

    private static final String SELECT_LATEST = """
                SELECT * FROM job_executions
                WHERE job_id = ?
                ORDER BY id DESC
                LIMIT 1
            """;

    private final Database db;

    public JdbcExecutionRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<ExecutionRecord> findLatestByJobId(String jobId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(SELECT_LATEST)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<ExecutionRecord> found = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return found;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find execution of job: " + jobId, e);
        }
    }

    @Override
    public ExecutionRecord upsertLatest(ExecutionRecord fresh) {
        try {
            return db.inTransaction(conn -> {
                Optional<ExecutionRecord> current = lockLatest(conn, fresh.jobId());
                Instant now = Instant.now();
                if (current.isPresent()) {
                    ExecutionRecord reset = fresh.toBuilder()
                            .id(current.get().id())
                            .createdAt(current.get().createdAt())
                            .updatedAt(now)
                            .build();
                    write(conn, reset);
                    log.debug("Reset execution {} of job {} to {}", reset.id(), reset.jobId(), reset.status());
                    return reset;
                }
                ExecutionRecord created = insert(conn, fresh.toBuilder().createdAt(now).updatedAt(now).build());
                log.debug("Created execution {} for job {}", created.id(), created.jobId());
                return created;
            });
        } catch (SQLException e) {
            throw new JobStoreException("Failed to record execution of job: " + fresh.jobId(), e);
        }
    }

    @Override
    public Optional<ExecutionRecord> updateLatest(String jobId, UnaryOperator<ExecutionRecord> change) {
        try {
            return db.inTransaction(conn -> {
                Optional<ExecutionRecord> current = lockLatest(conn, jobId);
                if (current.isEmpty()) {
                    return Optional.<ExecutionRecord>empty();
                }
                ExecutionRecord updated = change.apply(current.get()).toBuilder()
                        .id(current.get().id())
                        .jobId(jobId)
                        .createdAt(current.get().createdAt())
                        .updatedAt(Instant.now())
                        .build();
                write(conn, updated);
                log.debug("Execution {} of job {} is now {}", updated.id(), jobId, updated.status());
                return Optional.of(updated);
            });
        } catch (SQLException e) {
            throw new JobStoreException("Failed to update execution of job: " + jobId, e);
        }
    }

    @Override
    public int deleteByJobIds(Collection<String> jobIds) {
        if (jobIds.isEmpty())
            return 0;

        String sql = "DELETE FROM job_executions WHERE job_id IN ("
                + String.join(", ", Collections.nCopies(jobIds.size(), "?")) + ")";

        try {
            return db.inTransaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    int index = 1;
                    for (String jobId : jobIds) {
                        ps.setString(index++, jobId);
                    }
                    return ps.executeUpdate();
                }
            });
        } catch (SQLException e) {
            throw new JobStoreException("Failed to delete executions of jobs: " + jobIds, e);
        }
    }

    @Override
    public int countByJobId(String jobId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM job_executions WHERE job_id = ?")) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                int count = rs.next() ? rs.getInt(1) : 0;
                conn.commit();
                return count;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to count executions of job: " + jobId, e);
        }
    }

    // Helper methods

    private Optional<ExecutionRecord> lockLatest(Connection conn, String jobId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(SELECT_LATEST + " FOR UPDATE")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    private ExecutionRecord insert(Connection conn, ExecutionRecord record) throws SQLException {
        String sql = """
                    INSERT INTO job_executions (job_id, status, run_time, trigger_kind, finished, exception, traceback,
                                                created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, record.jobId());
            ps.setString(2, record.status().name());
            setTimestamp(ps, 3, record.runTime());
            ps.setString(4, record.triggerKind().name());
            setTimestamp(ps, 5, record.finished());
            ps.setString(6, truncate(record.exception()));
            ps.setString(7, record.traceback());
            setTimestamp(ps, 8, record.createdAt());
            setTimestamp(ps, 9, record.updatedAt());
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for execution of job " + record.jobId());
                }
                return record.toBuilder().id(keys.getLong(1)).build();
            }
        }
    }

    private void write(Connection conn, ExecutionRecord record) throws SQLException {
        String sql = """
                    UPDATE job_executions
                    SET status = ?, run_time = ?, trigger_kind = ?, finished = ?, exception = ?, traceback = ?,
                        updated_at = ?
                    WHERE id = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, record.status().name());
            setTimestamp(ps, 2, record.runTime());
            ps.setString(3, record.triggerKind().name());
            setTimestamp(ps, 4, record.finished());
            ps.setString(5, truncate(record.exception()));
            ps.setString(6, record.traceback());
            setTimestamp(ps, 7, record.updatedAt());
            ps.setLong(8, record.id());
            ps.executeUpdate();
        }
    }

    private ExecutionRecord mapRow(ResultSet rs) throws SQLException {
        return ExecutionRecord.builder()
                .id(rs.getLong("id"))
                .jobId(rs.getString("job_id"))
                .status(ExecutionStatus.valueOf(rs.getString("status")))
                .runTime(toInstant(rs.getTimestamp("run_time")))
                .triggerKind(TriggerKind.valueOf(rs.getString("trigger_kind")))
                .finished(toInstant(rs.getTimestamp("finished")))
                .exception(rs.getString("exception"))
                .traceback(rs.getString("traceback"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= EXCEPTION_MAX_LENGTH) {
            return value;
        }
        return value.substring(0, EXCEPTION_MAX_LENGTH);
    }
}
