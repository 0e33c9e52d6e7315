package notestore.jdbc.tx;

import notestore.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight transaction manager for manual JDBC usage. Obtains a connection and
 * disables auto-commit for the lifetime of a {@link Transaction}.
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     JdbcTemplate.batchUpdate(tx.connection(), sql, rows);
 *     tx.afterCommit(() -> syncQueue.appendAll(operations));
 *     tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /**
   * Begins a new transaction on a fresh connection.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
    } catch (SQLException e) {
      connection.close();
      throw e;
    }
    return new Transaction(connection);
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} triggers a rollback automatically.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();
    private boolean completed;

    private Transaction(Connection connection) {
      this.connection = connection;
    }

    public Connection connection() {
      return connection;
    }

    /**
     * Registers a callback to run once the transaction has committed. Callbacks run in
     * registration order; a failing callback is logged and does not affect the others.
     * Callbacks are discarded on rollback.
     */
    public void afterCommit(Runnable callback) {
      afterCommit.add(Objects.requireNonNull(callback, "callback"));
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      boolean committed = false;
      try {
        connection.commit();
        committed = true;
      } catch (SQLException e) {
        safeRollback(e);
        throw e;
      } finally {
        finalizeTx();
      }
      if (committed) {
        for (Runnable callback : afterCommit) {
          runSafely(callback);
        }
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finalizeTx();
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finalizeTx() throws SQLException {
      completed = true;
      try {
        connection.setAutoCommit(true);
      } finally {
        connection.close();
      }
    }

    private void safeRollback(SQLException cause) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        cause.addSuppressed(e);
      }
    }

    private static void runSafely(Runnable callback) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "After-commit callback failed", e);
      }
    }
  }
}
