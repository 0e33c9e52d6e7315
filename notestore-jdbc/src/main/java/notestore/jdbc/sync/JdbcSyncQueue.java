package notestore.jdbc.sync;

import notestore.StorageUnavailableException;
import notestore.jdbc.JdbcTemplate;
import notestore.jdbc.TableNames;
import notestore.model.SyncOperation;
import notestore.model.SyncOperationType;
import notestore.spi.ConnectionProvider;
import notestore.spi.MetricsExporter;
import notestore.spi.SyncQueue;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sync queue persisted in the {@value TableNames#SYNC_QUEUE} table.
 *
 * <p>Pending operations are returned ordered by timestamp, then by insertion sequence.
 * Append failures are logged and counted, never propagated: the mutation that produced the
 * operation is already durable and must not be reported as failed.
 */
public final class JdbcSyncQueue implements SyncQueue {
  private static final Logger logger = Logger.getLogger(JdbcSyncQueue.class.getName());

  private static final String INSERT_SQL = "INSERT INTO " + TableNames.SYNC_QUEUE +
      " (op_id, op_type, table_name, item_id, payload, occurred_at) VALUES (?,?,?,?,?,?)";

  private static final JdbcTemplate.RowMapper<SyncOperation> OPERATION_ROW_MAPPER = rs -> new SyncOperation(
      rs.getString("op_id"),
      SyncOperationType.fromCode(rs.getString("op_type")),
      rs.getString("table_name"),
      rs.getString("item_id"),
      rs.getString("payload"),
      rs.getTimestamp("occurred_at").toInstant());

  private final ConnectionProvider connectionProvider;
  private final MetricsExporter metrics;

  public JdbcSyncQueue(ConnectionProvider connectionProvider) {
    this(connectionProvider, MetricsExporter.NOOP);
  }

  public JdbcSyncQueue(ConnectionProvider connectionProvider, MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  @Override
  public void append(SyncOperation operation) {
    appendAll(List.of(Objects.requireNonNull(operation, "operation")));
  }

  @Override
  public void appendAll(List<SyncOperation> operations) {
    if (operations.isEmpty()) {
      return;
    }
    List<Object[]> rows = new ArrayList<>(operations.size());
    for (SyncOperation op : operations) {
      rows.add(new Object[] {
          op.id(), op.type().code(), op.table(), op.itemId(), op.dataJson(), Timestamp.from(op.timestamp())
      });
    }
    try (Connection conn = connectionProvider.getConnection()) {
      JdbcTemplate.batchUpdate(conn, INSERT_SQL, rows);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.WARNING,
          "Failed to append " + operations.size() + " sync operation(s), first " + operations.get(0).id(), e);
      metrics.incrementSyncAppendFailed(operations.size());
      return;
    }
    metrics.incrementSyncAppended(operations.size());
  }

  @Override
  public List<SyncOperation> pending() {
    List<SyncOperation> operations;
    try (Connection conn = connectionProvider.getConnection()) {
      operations = JdbcTemplate.query(conn,
          "SELECT op_id, op_type, table_name, item_id, payload, occurred_at FROM " + TableNames.SYNC_QUEUE +
              " ORDER BY occurred_at, seq",
          OPERATION_ROW_MAPPER);
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to read the sync queue", e);
    }
    metrics.recordSyncQueueDepth(operations.size());
    return operations;
  }

  /** Acknowledges an operation; unknown ids are ignored. */
  @Override
  public void remove(String operationId) {
    Objects.requireNonNull(operationId, "operationId");
    int rows;
    try (Connection conn = connectionProvider.getConnection()) {
      rows = JdbcTemplate.update(conn, "DELETE FROM " + TableNames.SYNC_QUEUE + " WHERE op_id=?", operationId);
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to remove sync operation " + operationId, e);
    }
    if (rows > 0) {
      metrics.incrementSyncAcknowledged(rows);
    }
  }

  @Override
  public void clear() {
    try (Connection conn = connectionProvider.getConnection()) {
      JdbcTemplate.update(conn, "DELETE FROM " + TableNames.SYNC_QUEUE);
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to clear the sync queue", e);
    }
    metrics.recordSyncQueueDepth(0);
  }

  @Override
  public int size() {
    int depth;
    try (Connection conn = connectionProvider.getConnection()) {
      depth = (int) JdbcTemplate.queryLong(conn, "SELECT COUNT(*) FROM " + TableNames.SYNC_QUEUE);
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to count the sync queue", e);
    }
    metrics.recordSyncQueueDepth(depth);
    return depth;
  }
}
