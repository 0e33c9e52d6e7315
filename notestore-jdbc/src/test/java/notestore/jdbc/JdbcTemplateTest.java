package notestore.jdbc;

import notestore.DuplicateEntityException;
import notestore.StorageUnavailableException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JdbcTemplateTest {

    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() {
        dataSource = TestDataSources.h2();
        TestDataSources.execute(dataSource,
                "CREATE TABLE item (id VARCHAR(36) PRIMARY KEY, n BIGINT, content BLOB)");
    }

    @Test
    void updateAndQueryRoundTripsTypedParameters() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            assertEquals(1, JdbcTemplate.update(conn, "INSERT INTO item VALUES (?,?,?)",
                    "a", 42L, new byte[] {1, 2}));

            Optional<byte[]> content = JdbcTemplate.queryOne(conn,
                    "SELECT content FROM item WHERE id=?", rs -> rs.getBytes(1), "a");

            assertArrayEquals(new byte[] {1, 2}, content.orElseThrow());
            assertEquals(42L, JdbcTemplate.queryLong(conn, "SELECT n FROM item WHERE id=?", "a"));
        }
    }

    @Test
    void queryOneReturnsEmptyWhenNoRow() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            assertTrue(JdbcTemplate.queryOne(conn, "SELECT id FROM item WHERE id=?",
                    rs -> rs.getString(1), "missing").isEmpty());
        }
    }

    @Test
    void batchUpdateInsertsAllRows() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            JdbcTemplate.batchUpdate(conn, "INSERT INTO item (id, n) VALUES (?,?)",
                    List.of(new Object[] {"a", 1L}, new Object[] {"b", 2L}, new Object[] {"c", 3L}));

            assertEquals(6L, JdbcTemplate.queryLong(conn, "SELECT SUM(n) FROM item"));
        }
    }

    @Test
    void uniqueViolationBecomesDuplicateEntityException() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            JdbcTemplate.update(conn, "INSERT INTO item (id) VALUES (?)", "a");

            assertThrows(DuplicateEntityException.class,
                    () -> JdbcTemplate.update(conn, "INSERT INTO item (id) VALUES (?)", "a"));
        }
    }

    @Test
    void otherFailuresBecomeStorageUnavailable() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            assertThrows(StorageUnavailableException.class,
                    () -> JdbcTemplate.query(conn, "SELECT * FROM missing_table", rs -> rs.getString(1)));
        }
    }
}
