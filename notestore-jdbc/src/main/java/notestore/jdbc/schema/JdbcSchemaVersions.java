package notestore.jdbc.schema;

import notestore.EntityType;
import notestore.jdbc.JdbcTemplate;
import notestore.jdbc.TableNames;
import notestore.migration.SchemaMigrations;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * Reads and writes the per-collection version held in {@value TableNames#SCHEMA_VERSIONS}.
 */
public final class JdbcSchemaVersions {

  private JdbcSchemaVersions() {}

  /**
   * @return the recorded version, or {@link SchemaMigrations#BASELINE_VERSION} when none is recorded
   */
  public static int read(Connection conn, EntityType<?> collection) {
    return JdbcTemplate.queryOne(conn,
            "SELECT schema_version FROM " + TableNames.SCHEMA_VERSIONS + " WHERE collection_name=?",
            rs -> rs.getInt("schema_version"), collection.name())
        .orElse(SchemaMigrations.BASELINE_VERSION);
  }

  public static void write(Connection conn, EntityType<?> collection, int version, Instant at) {
    JdbcTemplate.update(conn,
        "MERGE INTO " + TableNames.SCHEMA_VERSIONS +
            " (collection_name, schema_version, updated_at) KEY (collection_name) VALUES (?,?,?)",
        collection.name(), version, Timestamp.from(at));
  }
}
