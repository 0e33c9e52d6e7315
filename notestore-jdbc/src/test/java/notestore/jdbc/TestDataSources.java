package notestore.jdbc;

import notestore.jdbc.schema.SchemaInstaller;
import org.h2.jdbcx.JdbcDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.UUID;

/**
 * Fresh in-memory H2 databases for tests.
 */
public final class TestDataSources {

    private TestDataSources() {}

    public static String h2Url() {
        return "jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    }

    public static JdbcDataSource h2() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL(h2Url());
        return dataSource;
    }

    /** A fresh database with the store's tables installed. */
    public static JdbcDataSource h2WithSchema() {
        JdbcDataSource dataSource = h2();
        try (Connection conn = dataSource.getConnection()) {
            SchemaInstaller.install(conn);
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
        return dataSource;
    }

    public static void execute(JdbcDataSource dataSource, String sql) {
        try (Connection conn = dataSource.getConnection()) {
            conn.createStatement().execute(sql);
        } catch (SQLException e) {
            throw new IllegalStateException(e);
        }
    }
}
