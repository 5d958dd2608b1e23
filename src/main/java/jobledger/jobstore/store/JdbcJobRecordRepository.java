package jobledger.jobstore.store;

import jobledger.jobstore.exception.JobStoreException;
import jobledger.jobstore.model.JobRecord;
import jobledger.jobstore.model.TriggerKind;
import jobledger.jobstore.repository.JobRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of JobRecordRepository.
 * Deletes cascade to {@code job_executions} inside the same transaction.
 */
public class JdbcJobRecordRepository implements JobRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobRecordRepository.class);

    private static final String COLUMNS = "id, next_run_time, trigger_kind, job_state";

    private final Database db;

    public JdbcJobRecordRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<JobRecord> findById(String jobId) {
        String sql = "SELECT " + COLUMNS + " FROM job_records WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<JobRecord> found = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return found;
            }
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find job: " + jobId, e);
        }
    }

    @Override
    public List<JobRecord> findDue(Instant now) {
        String sql = """
                    SELECT %s FROM job_records
                    WHERE next_run_time <= ?
                    ORDER BY next_run_time, id
                """.formatted(COLUMNS);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(now));
            List<JobRecord> due = executeQuery(ps);
            conn.commit();
            return due;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to find due jobs", e);
        }
    }

    @Override
    public Optional<Instant> findEarliestNextRunTime() {
        // MIN over an indexed column is answered from the index
        String sql = "SELECT MIN(next_run_time) FROM job_records";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            Instant earliest = rs.next() ? toInstant(rs.getTimestamp(1)) : null;
            conn.commit();
            return Optional.ofNullable(earliest);
        } catch (SQLException e) {
            throw new JobStoreException("Failed to query next run time", e);
        }
    }

    @Override
    public List<JobRecord> findAll() {
        String sql = """
                    SELECT %s FROM job_records
                    ORDER BY next_run_time NULLS LAST, id
                """.formatted(COLUMNS);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            List<JobRecord> all = executeQuery(ps);
            conn.commit();
            return all;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to list jobs", e);
        }
    }

    @Override
    public boolean insert(JobRecord record) {
        String sql = "INSERT INTO job_records (" + COLUMNS + ") VALUES (?, ?, ?, ?)";

        try {
            db.inTransaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    ps.setString(1, record.id());
                    setTimestamp(ps, 2, record.nextRunTime());
                    ps.setString(3, record.triggerKind().name());
                    ps.setBytes(4, record.state());
                    return ps.executeUpdate();
                }
            });
            log.debug("Inserted job record {}", record.id());
            return true;
        } catch (SQLException e) {
            if (isIntegrityViolation(e)) {
                log.debug("Job record {} already exists", record.id());
                return false;
            }
            throw new JobStoreException("Failed to insert job: " + record.id(), e);
        }
    }

    @Override
    public boolean update(JobRecord record) {
        String sql = """
                    UPDATE job_records
                    SET next_run_time = ?, trigger_kind = ?, job_state = ?
                    WHERE id = ?
                """;

        try {
            int updated = db.inTransaction(conn -> {
                try (PreparedStatement ps = conn.prepareStatement(sql)) {
                    setTimestamp(ps, 1, record.nextRunTime());
                    ps.setString(2, record.triggerKind().name());
                    ps.setBytes(3, record.state());
                    ps.setString(4, record.id());
                    return ps.executeUpdate();
                }
            });
            if (updated > 0) {
                log.debug("Updated job record {} (next run {})", record.id(), record.nextRunTime());
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to update job: " + record.id(), e);
        }
    }

    @Override
    public boolean delete(String jobId) {
        return deleteByIds(List.of(jobId)) > 0;
    }

    @Override
    public int deleteByIds(Collection<String> jobIds) {
        if (jobIds.isEmpty())
            return 0;

        String placeholders = String.join(", ", Collections.nCopies(jobIds.size(), "?"));

        try {
            int deleted = db.inTransaction(conn -> {
                // First delete executions, then jobs
                try (PreparedStatement ps = conn.prepareStatement(
                        "DELETE FROM job_executions WHERE job_id IN (" + placeholders + ")")) {
                    bindAll(ps, jobIds);
                    ps.executeUpdate();
                }
                try (PreparedStatement ps = conn.prepareStatement(
                        "DELETE FROM job_records WHERE id IN (" + placeholders + ")")) {
                    bindAll(ps, jobIds);
                    return ps.executeUpdate();
                }
            });
            log.debug("Deleted {} job record(s) of {}", deleted, jobIds);
            return deleted;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to delete jobs: " + jobIds, e);
        }
    }

    @Override
    public int deleteAll() {
        try {
            int deleted = db.inTransaction(conn -> {
                try (Statement st = conn.createStatement()) {
                    st.executeUpdate("DELETE FROM job_executions WHERE job_id IN (SELECT id FROM job_records)");
                    return st.executeUpdate("DELETE FROM job_records");
                }
            });
            log.debug("Deleted all {} job record(s)", deleted);
            return deleted;
        } catch (SQLException e) {
            throw new JobStoreException("Failed to delete all jobs", e);
        }
    }

    // Helper methods

    private List<JobRecord> executeQuery(PreparedStatement ps) throws SQLException {
        List<JobRecord> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private JobRecord mapRow(ResultSet rs) throws SQLException {
        return new JobRecord(
                rs.getString("id"),
                toInstant(rs.getTimestamp("next_run_time")),
                TriggerKind.valueOf(rs.getString("trigger_kind")),
                rs.getBytes("job_state"));
    }

    private static void bindAll(PreparedStatement ps, Collection<String> values) throws SQLException {
        int index = 1;
        for (String value : values) {
            ps.setString(index++, value);
        }
    }

    /** SQLState class 23 covers unique and primary key violations on every major database. */
    static boolean isIntegrityViolation(SQLException e) {
        if (e instanceof SQLIntegrityConstraintViolationException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith("23");
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
