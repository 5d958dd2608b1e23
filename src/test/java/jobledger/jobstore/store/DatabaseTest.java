package jobledger.jobstore.store;

import jobledger.jobstore.TestJobs;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseTest {

    @Test
    void schemaIsCreatedAndPoolCloses() {
        Database db = new Database(TestJobs.h2Url("test-database-" + System.nanoTime()), 2);
        assertTrue(db.isHealthy());

        db.close();
        assertTrue(db.isClosed());
        assertFalse(db.isHealthy());
    }

    @Test
    void failedTransactionIsRolledBack() throws Exception {
        try (Database db = new Database(TestJobs.h2Url("test-database-tx"), 2)) {
            assertThrows(SQLException.class, () -> db.inTransaction(conn -> {
                try (var st = conn.createStatement()) {
                    st.executeUpdate("INSERT INTO job_records (id, trigger_kind, job_state) VALUES ('tx-1', 'DATE', X'00')");
                    // same id again violates the primary key
                    st.executeUpdate("INSERT INTO job_records (id, trigger_kind, job_state) VALUES ('tx-1', 'DATE', X'00')");
                }
                return null;
            }));

            int rows = db.inTransaction(conn -> {
                try (var st = conn.createStatement();
                        var rs = st.executeQuery("SELECT COUNT(*) FROM job_records WHERE id = 'tx-1'")) {
                    rs.next();
                    return rs.getInt(1);
                }
            });
            assertEquals(0, rows);
        }
    }
}
