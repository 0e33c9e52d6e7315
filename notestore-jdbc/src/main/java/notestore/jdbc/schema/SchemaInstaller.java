package notestore.jdbc.schema;

import notestore.EntityType;
import notestore.jdbc.JdbcTemplate;
import notestore.jdbc.TableNames;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Creates the store's tables if they do not exist yet. Statements use H2 syntax.
 *
 * <p>Each collection table holds the entity JSON in {@code body}; {@code created_at} and
 * {@code updated_at} mirror the document's timestamps for SQL-side sorting.
 */
public final class SchemaInstaller {
  private static final Logger logger = Logger.getLogger(SchemaInstaller.class.getName());

  private SchemaInstaller() {}

  public static void install(Connection conn) {
    for (String statement : statements()) {
      JdbcTemplate.update(conn, statement);
    }
    logger.fine("Schema installed");
  }

  static List<String> statements() {
    List<String> ddl = new ArrayList<>();
    for (EntityType<?> type : EntityType.values()) {
      String table = TableNames.validate(type.name());
      ddl.add("CREATE TABLE IF NOT EXISTS " + table + " (" +
          "id VARCHAR(64) PRIMARY KEY, " +
          "body CLOB NOT NULL, " +
          "created_at TIMESTAMP NOT NULL, " +
          "updated_at TIMESTAMP NOT NULL)");
      ddl.add("CREATE INDEX IF NOT EXISTS idx_" + table + "_created_at ON " + table + " (created_at)");
      ddl.add("CREATE INDEX IF NOT EXISTS idx_" + table + "_updated_at ON " + table + " (updated_at)");
    }
    ddl.add("CREATE TABLE IF NOT EXISTS " + TableNames.SYNC_QUEUE + " (" +
        "seq BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
        "op_id VARCHAR(36) NOT NULL UNIQUE, " +
        "op_type VARCHAR(16) NOT NULL, " +
        "table_name VARCHAR(64) NOT NULL, " +
        "item_id VARCHAR(64) NOT NULL, " +
        "payload CLOB, " +
        "occurred_at TIMESTAMP NOT NULL)");
    ddl.add("CREATE INDEX IF NOT EXISTS idx_sync_queue_order ON " + TableNames.SYNC_QUEUE +
        " (occurred_at, seq)");
    ddl.add("CREATE TABLE IF NOT EXISTS " + TableNames.BLOBS + " (" +
        "blob_key VARCHAR(255) PRIMARY KEY, " +
        "content BLOB NOT NULL, " +
        "mime_type VARCHAR(255) NOT NULL, " +
        "byte_size BIGINT NOT NULL, " +
        "created_at TIMESTAMP NOT NULL)");
    ddl.add("CREATE TABLE IF NOT EXISTS " + TableNames.SCHEMA_VERSIONS + " (" +
        "collection_name VARCHAR(64) PRIMARY KEY, " +
        "schema_version INT NOT NULL, " +
        "updated_at TIMESTAMP NOT NULL)");
    return ddl;
  }
}
