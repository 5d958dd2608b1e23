package jobledger.jobstore.store;

import jobledger.jobstore.TestJobs;
import jobledger.jobstore.model.JobRecord;
import jobledger.jobstore.model.TriggerKind;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;
import java.sql.PreparedStatement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static jobledger.jobstore.TestJobs.T0;
import static org.junit.jupiter.api.Assertions.*;

class JdbcJobRecordRepositoryTest {

    private static Database db;
    private static JdbcJobRecordRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database(TestJobs.h2Url("test-job-records"), 4);
        repo = new JdbcJobRecordRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM job_executions");
            st.execute("DELETE FROM job_records");
            conn.commit();
        }
    }

    private static JobRecord record(String id, Instant nextRunTime) {
        return new JobRecord(id, nextRunTime, TriggerKind.INTERVAL, ("state-" + id).getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void insertAndFindById() {
        assertTrue(repo.insert(record("job-1", T0)));

        Optional<JobRecord> found = repo.findById("job-1");
        assertTrue(found.isPresent());
        assertEquals(T0, found.get().nextRunTime());
        assertEquals(TriggerKind.INTERVAL, found.get().triggerKind());
        assertArrayEquals("state-job-1".getBytes(StandardCharsets.UTF_8), found.get().state());
    }

    @Test
    void largeBinaryStateIsStoredUnchanged() {
        byte[] state = new byte[256 * 1024];
        for (int i = 0; i < state.length; i++) {
            state[i] = (byte) i;
        }
        assertTrue(repo.insert(new JobRecord("job-big", T0, TriggerKind.CRON, state)));

        assertArrayEquals(state, repo.findById("job-big").orElseThrow().state());
    }

    @Test
    void findByIdMissingIsEmpty() {
        assertTrue(repo.findById("nope").isEmpty());
    }

    @Test
    void insertDuplicateIsRejectedAndKeepsOriginal() {
        assertTrue(repo.insert(record("job-dup", T0)));

        JobRecord other = new JobRecord("job-dup", T0.plusSeconds(60), TriggerKind.DATE, new byte[] { 1, 2, 3 });
        assertFalse(repo.insert(other));

        JobRecord stored = repo.findById("job-dup").orElseThrow();
        assertEquals(T0, stored.nextRunTime());
        assertEquals(TriggerKind.INTERVAL, stored.triggerKind());
    }

    @Test
    void updateReplacesRunTimeAndState() {
        repo.insert(record("job-upd", T0));

        assertTrue(repo.update(new JobRecord("job-upd", null, TriggerKind.INTERVAL, new byte[] { 9 })));

        JobRecord stored = repo.findById("job-upd").orElseThrow();
        assertNull(stored.nextRunTime());
        assertTrue(stored.isPaused());
        assertArrayEquals(new byte[] { 9 }, stored.state());
    }

    @Test
    void updateMissingReturnsFalse() {
        assertFalse(repo.update(record("ghost", T0)));
        assertTrue(repo.findById("ghost").isEmpty());
    }

    @Test
    void findDueIsInclusiveAndSorted() {
        repo.insert(record("late", T0.plusSeconds(120)));
        repo.insert(record("b-tie", T0));
        repo.insert(record("a-tie", T0));
        repo.insert(record("early", T0.minusSeconds(300)));
        repo.insert(record("future", T0.plusSeconds(3600)));
        repo.insert(record("paused", null));

        List<String> due = repo.findDue(T0.plusSeconds(120)).stream().map(JobRecord::id).toList();

        assertEquals(List.of("early", "a-tie", "b-tie", "late"), due);
    }

    @Test
    void earliestNextRunTimeIgnoresPausedJobs() {
        assertTrue(repo.findEarliestNextRunTime().isEmpty());

        repo.insert(record("paused", null));
        assertTrue(repo.findEarliestNextRunTime().isEmpty());

        repo.insert(record("second", T0.plusSeconds(10)));
        repo.insert(record("first", T0));
        assertEquals(Optional.of(T0), repo.findEarliestNextRunTime());
    }

    @Test
    void findAllPutsPausedJobsLast() {
        repo.insert(record("paused-1", null));
        repo.insert(record("later", T0.plusSeconds(60)));
        repo.insert(record("sooner", T0));
        repo.insert(record("paused-0", null));

        List<String> all = repo.findAll().stream().map(JobRecord::id).toList();

        assertEquals(List.of("sooner", "later", "paused-0", "paused-1"), all);
    }

    @Test
    void deleteCascadesToExecutions() throws Exception {
        repo.insert(record("job-del", T0));
        repo.insert(record("job-keep", T0));
        insertExecution("job-del");
        insertExecution("job-keep");

        assertTrue(repo.delete("job-del"));
        assertFalse(repo.delete("job-del"));

        assertTrue(repo.findById("job-del").isEmpty());
        assertEquals(0, countExecutions("job-del"));
        assertEquals(1, countExecutions("job-keep"));
    }

    @Test
    void deleteByIdsIgnoresUnknownIds() {
        repo.insert(record("a", T0));
        repo.insert(record("b", T0));
        repo.insert(record("c", T0));

        assertEquals(2, repo.deleteByIds(List.of("a", "c", "zzz")));
        assertEquals(List.of("b"), repo.findAll().stream().map(JobRecord::id).toList());
        assertEquals(0, repo.deleteByIds(List.of()));
    }

    @Test
    void deleteAllRemovesJobsAndTheirExecutions() throws Exception {
        repo.insert(record("x", T0));
        repo.insert(record("y", null));
        insertExecution("x");
        insertExecution("y");

        assertEquals(2, repo.deleteAll());

        assertTrue(repo.findAll().isEmpty());
        assertEquals(0, countExecutions("x"));
        assertEquals(0, countExecutions("y"));
    }

    private static void insertExecution(String jobId) throws Exception {
        try (var conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO job_executions (job_id, status, run_time, trigger_kind) VALUES (?, 'ADDED', ?, 'CRON')")) {
            ps.setString(1, jobId);
            ps.setTimestamp(2, Timestamp.from(T0));
            ps.executeUpdate();
            conn.commit();
        }
    }

    private static int countExecutions(String jobId) {
        return new JdbcExecutionRepository(db).countByJobId(jobId);
    }
}
