package notestore.jdbc.blob;

import notestore.jdbc.TableNames;
import notestore.spi.ConnectionProvider;
import notestore.spi.MetricsExporter;

import java.time.Clock;

/**
 * H2 blob store. Replaces existing keys with {@code MERGE INTO ... KEY (blob_key)}.
 */
public final class H2BlobStore extends AbstractJdbcBlobStore {

  public H2BlobStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, MetricsExporter.NOOP, Clock.systemUTC());
  }

  public H2BlobStore(ConnectionProvider connectionProvider, MetricsExporter metrics, Clock clock) {
    super(connectionProvider, metrics, clock);
  }

  @Override
  protected String upsertSql() {
    return "MERGE INTO " + TableNames.BLOBS +
        " (blob_key, content, mime_type, byte_size, created_at) KEY (blob_key) VALUES (?,?,?,?,?)";
  }
}
