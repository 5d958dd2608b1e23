package jobledger.jobstore.service;

import jobledger.jobstore.TestJobs;
import jobledger.jobstore.exception.ConflictingIdException;
import jobledger.jobstore.exception.JobNotFoundException;
import jobledger.jobstore.ledger.ExecutionLedger;
import jobledger.jobstore.model.Job;
import jobledger.jobstore.model.JobRecord;
import jobledger.jobstore.model.TriggerKind;
import jobledger.jobstore.model.TriggerSpec;
import jobledger.jobstore.serializer.JsonJobSerializer;
import jobledger.jobstore.store.Database;
import jobledger.jobstore.store.JdbcExecutionRepository;
import jobledger.jobstore.store.JdbcJobRecordRepository;
import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static jobledger.jobstore.TestJobs.T0;
import static jobledger.jobstore.TestJobs.job;
import static jobledger.jobstore.TestJobs.paused;
import static org.junit.jupiter.api.Assertions.*;

class JdbcJobStoreTest {

    private static Database db;
    private static JdbcJobRecordRepository records;
    private static JsonJobSerializer serializer;

    private JdbcJobStore store;

    @BeforeAll
    static void setup() {
        db = new Database(TestJobs.h2Url("test-jdbc-store"), 4);
        records = new JdbcJobRecordRepository(db);
        serializer = new JsonJobSerializer();
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
        store = new JdbcJobStore(records, serializer, new ExecutionLedger(new JdbcExecutionRepository(db)));
    }

    private static List<String> ids(List<Job> jobs) {
        return jobs.stream().map(Job::id).toList();
    }

    @Test
    void lookupReturnsWhatWasAdded() {
        Job job = job("job-1", T0);
        store.addJob(job);

        Optional<Job> found = store.lookupJob("job-1");

        assertTrue(found.isPresent());
        assertEquals(job, found.get());
        assertEquals(TriggerKind.CRON, records.findById("job-1").orElseThrow().triggerKind());
    }

    @Test
    void lookupKeepsArgumentTypes() {
        Job job = job("typed", T0).toBuilder()
                .args(List.of(5L, T0, List.of(7L, "x")))
                .kwargs(Map.of("limit", new BigDecimal("12.50"), "day", LocalDate.of(2030, 1, 15)))
                .build();
        store.addJob(job);

        Job found = store.lookupJob("typed").orElseThrow();

        assertEquals(job, found);
        assertInstanceOf(Long.class, found.args().get(0));
        assertInstanceOf(Instant.class, found.args().get(1));
    }

    @Test
    void lookupOfUnknownJobIsEmpty() {
        assertTrue(store.lookupJob("nope").isEmpty());
    }

    @Test
    void addWithDuplicateIdFailsAndKeepsExistingJob() {
        Job original = job("dup", T0);
        store.addJob(original);

        Job intruder = job("dup", T0.plusSeconds(60)).toBuilder().target("com.acme.Other#run").build();
        ConflictingIdException e = assertThrows(ConflictingIdException.class, () -> store.addJob(intruder));

        assertEquals("dup", e.jobId());
        assertEquals(original, store.lookupJob("dup").orElseThrow());
    }

    @Test
    void updateReplacesStoredJob() {
        store.addJob(job("upd", T0));

        Job rescheduled = job("upd", T0.plusSeconds(3600)).toBuilder()
                .trigger(TriggerSpec.interval(3600))
                .build();
        store.updateJob(rescheduled);

        assertEquals(rescheduled, store.lookupJob("upd").orElseThrow());
        assertEquals(Optional.of(T0.plusSeconds(3600)), store.getNextRunTime());
    }

    @Test
    void updateAndRemoveOfAbsentJobFail() {
        assertThrows(JobNotFoundException.class, () -> store.updateJob(job("ghost", T0)));
        assertThrows(JobNotFoundException.class, () -> store.removeJob("ghost"));
    }

    @Test
    void blankIdsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.addJob(job(" ", T0)));
        assertThrows(IllegalArgumentException.class, () -> store.lookupJob(""));
        assertThrows(NullPointerException.class, () -> store.addJob(null));
    }

    @Test
    void dueJobsAreExactlyThoseAtOrBeforeNowInOrder() {
        store.addJob(job("c", T0.plusSeconds(30)));
        store.addJob(job("a", T0.minusSeconds(30)));
        store.addJob(job("b", T0));
        store.addJob(job("future", T0.plusSeconds(31)));
        store.addJob(paused("paused"));

        assertEquals(List.of("a", "b", "c"), ids(store.getDueJobs(T0.plusSeconds(30))));
        assertEquals(List.of("a"), ids(store.getDueJobs(T0.minusSeconds(1))));
        assertTrue(store.getDueJobs(T0.minusSeconds(3600)).isEmpty());
    }

    @Test
    void nextRunTimeIsMinimumOrEmpty() {
        assertTrue(store.getNextRunTime().isEmpty());

        store.addJob(paused("paused"));
        assertTrue(store.getNextRunTime().isEmpty());

        store.addJob(job("later", T0.plusSeconds(10)));
        store.addJob(job("sooner", T0));
        assertEquals(Optional.of(T0), store.getNextRunTime());
    }

    @Test
    void allJobsListPausedJobsLast() {
        store.addJob(paused("p1"));
        store.addJob(job("s2", T0.plusSeconds(5)));
        store.addJob(job("s1", T0));

        assertEquals(List.of("s1", "s2", "p1"), ids(store.getAllJobs()));
    }

    @Test
    void corruptStateIsQuarantinedOnScan() {
        store.addJob(job("good", T0));
        records.insert(new JobRecord("corrupt", T0.minusSeconds(1), TriggerKind.DATE,
                "\u0080not-a-job".getBytes(StandardCharsets.UTF_8)));

        assertEquals(List.of("good"), ids(store.getAllJobs()));

        assertTrue(records.findById("corrupt").isEmpty());
        assertTrue(store.lookupJob("corrupt").isEmpty());
        assertEquals(List.of("good"), ids(store.getDueJobs(T0)));
    }

    @Test
    void corruptDueJobIsQuarantinedAndOthersStillDue() {
        store.addJob(job("ok-1", T0.minusSeconds(10)));
        records.insert(new JobRecord("broken", T0.minusSeconds(5), TriggerKind.CRON, new byte[] { 1, 2, 3 }));
        store.addJob(job("ok-2", T0));

        assertEquals(List.of("ok-1", "ok-2"), ids(store.getDueJobs(T0)));
        assertTrue(records.findById("broken").isEmpty());
    }

    @Test
    void stateBelongingToAnotherJobIsQuarantinedOnLookup() {
        byte[] foreign = serializer.encode(job("someone-else", T0));
        records.insert(new JobRecord("impostor", T0, TriggerKind.CRON, foreign));

        assertTrue(store.lookupJob("impostor").isEmpty());
        assertTrue(records.findById("impostor").isEmpty());
    }

    @Test
    void removeAllJobsEmptiesTheStore() {
        store.addJob(job("a", T0));
        store.addJob(paused("b"));

        store.removeAllJobs();

        assertTrue(store.getAllJobs().isEmpty());
        assertTrue(store.getNextRunTime().isEmpty());
    }

    @Test
    void operationsFailAfterShutdown() {
        store.shutdown();
        store.shutdown();

        assertThrows(IllegalStateException.class, () -> store.getAllJobs());
        assertThrows(IllegalStateException.class, () -> store.addJob(job("late", T0)));
    }
}
