package notestore.jdbc.blob;

import notestore.StorageUnavailableException;
import notestore.jdbc.JdbcTemplate;
import notestore.jdbc.TableNames;
import notestore.model.BlobRecord;
import notestore.spi.BlobStore;
import notestore.spi.ConnectionProvider;
import notestore.spi.MetricsExporter;
import notestore.util.Ids;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC blob store over the {@value TableNames#BLOBS} table.
 *
 * <p>Subclasses supply the database-specific upsert used by {@link #store}.
 *
 * @see H2BlobStore
 */
public abstract class AbstractJdbcBlobStore implements BlobStore {
  static final String DEFAULT_MIME_TYPE = "application/octet-stream";

  private static final JdbcTemplate.RowMapper<BlobRecord> RECORD_ROW_MAPPER = rs -> new BlobRecord(
      rs.getString("blob_key"),
      rs.getBytes("content"),
      rs.getString("mime_type"),
      rs.getLong("byte_size"),
      rs.getTimestamp("created_at").toInstant());

  private final ConnectionProvider connectionProvider;
  private final MetricsExporter metrics;
  private final Clock clock;

  protected AbstractJdbcBlobStore(ConnectionProvider connectionProvider, MetricsExporter metrics, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Insert-or-replace statement binding, in order: key, content, MIME type, size, creation time.
   */
  protected abstract String upsertSql();

  @Override
  public String store(String key, byte[] data, String mimeType) {
    Objects.requireNonNull(data, "data");
    String blobKey = key == null ? Ids.newBlobKey("blob") : key;
    String type = mimeType == null ? DEFAULT_MIME_TYPE : mimeType;
    try (Connection conn = connectionProvider.getConnection()) {
      JdbcTemplate.update(conn, upsertSql(),
          blobKey, data, type, (long) data.length, Timestamp.from(clock.instant()));
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to store blob " + blobKey, e);
    }
    metrics.recordBlobStored(data.length);
    return blobKey;
  }

  @Override
  public Optional<byte[]> get(String key) {
    Objects.requireNonNull(key, "key");
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.queryOne(conn,
          "SELECT content FROM " + TableNames.BLOBS + " WHERE blob_key=?",
          rs -> rs.getBytes("content"), key);
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to read blob " + key, e);
    }
  }

  @Override
  public Optional<BlobRecord> getRecord(String key) {
    Objects.requireNonNull(key, "key");
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.queryOne(conn,
          "SELECT blob_key, content, mime_type, byte_size, created_at FROM " + TableNames.BLOBS +
              " WHERE blob_key=?",
          RECORD_ROW_MAPPER, key);
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to read blob " + key, e);
    }
  }

  /** Idempotent; deleting an unknown key is not an error. */
  @Override
  public void delete(String key) {
    Objects.requireNonNull(key, "key");
    int rows;
    try (Connection conn = connectionProvider.getConnection()) {
      rows = JdbcTemplate.update(conn, "DELETE FROM " + TableNames.BLOBS + " WHERE blob_key=?", key);
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to delete blob " + key, e);
    }
    if (rows > 0) {
      metrics.incrementBlobDeleted();
    }
  }

  @Override
  public List<String> keys() {
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.query(conn,
          "SELECT blob_key FROM " + TableNames.BLOBS + " ORDER BY blob_key",
          rs -> rs.getString("blob_key"));
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to list blob keys", e);
    }
  }

  @Override
  public long totalSize() {
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.queryLong(conn, "SELECT COALESCE(SUM(byte_size), 0) FROM " + TableNames.BLOBS);
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to compute blob storage size", e);
    }
  }
}
