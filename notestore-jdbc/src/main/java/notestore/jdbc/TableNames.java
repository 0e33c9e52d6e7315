package notestore.jdbc;

import java.util.Objects;

/**
 * Table names of the store and their validation.
 *
 * <p>Entity tables are named after their collection, see {@link notestore.EntityType#name()}.
 */
public final class TableNames {
  public static final String SYNC_QUEUE = "sync_queue";
  public static final String BLOBS = "blobs";
  public static final String SCHEMA_VERSIONS = "schema_versions";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
