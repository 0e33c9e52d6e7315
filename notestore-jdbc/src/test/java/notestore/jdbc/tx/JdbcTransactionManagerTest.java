package notestore.jdbc.tx;

import notestore.jdbc.DataSourceConnectionProvider;
import notestore.jdbc.JdbcTemplate;
import notestore.jdbc.TestDataSources;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcTransactionManagerTest {

    private JdbcDataSource dataSource;
    private JdbcTransactionManager txManager;

    @BeforeEach
    void setUp() {
        dataSource = TestDataSources.h2();
        TestDataSources.execute(dataSource, "CREATE TABLE item (id VARCHAR(36) PRIMARY KEY)");
        txManager = new JdbcTransactionManager(new DataSourceConnectionProvider(dataSource));
    }

    @Test
    void commitMakesChangesVisibleAndRunsCallbacksInOrder() throws Exception {
        List<String> calls = new ArrayList<>();
        try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
            JdbcTemplate.update(tx.connection(), "INSERT INTO item VALUES (?)", "a");
            tx.afterCommit(() -> calls.add("first"));
            tx.afterCommit(() -> calls.add("second"));
            assertTrue(calls.isEmpty());
            tx.commit();
        }

        assertEquals(List.of("first", "second"), calls);
        assertEquals(1L, countItems());
    }

    @Test
    void closeWithoutCommitRollsBackAndSkipsCallbacks() throws Exception {
        List<String> calls = new ArrayList<>();
        try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
            JdbcTemplate.update(tx.connection(), "INSERT INTO item VALUES (?)", "a");
            tx.afterCommit(() -> calls.add("commit"));
        }

        assertTrue(calls.isEmpty());
        assertEquals(0L, countItems());
    }

    @Test
    void explicitRollbackDiscardsChanges() throws Exception {
        try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
            JdbcTemplate.update(tx.connection(), "INSERT INTO item VALUES (?)", "a");
            tx.rollback();
        }

        assertEquals(0L, countItems());
    }

    @Test
    void failingCallbackDoesNotStopLaterCallbacks() throws Exception {
        List<String> calls = new ArrayList<>();
        try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
            tx.afterCommit(() -> {
                throw new IllegalStateException("boom");
            });
            tx.afterCommit(() -> calls.add("after"));
            tx.commit();
        }

        assertEquals(List.of("after"), calls);
    }

    @Test
    void connectionIsClosedAfterCommit() throws Exception {
        Connection conn;
        try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
            conn = tx.connection();
            tx.commit();
        }

        assertTrue(conn.isClosed());
    }

    private long countItems() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            return JdbcTemplate.queryLong(conn, "SELECT COUNT(*) FROM item");
        }
    }
}
