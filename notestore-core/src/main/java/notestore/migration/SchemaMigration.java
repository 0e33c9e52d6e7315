package notestore.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import notestore.EntityType;

/**
 * One step of a collection's schema history: rewrites a stored row from version
 * {@link #fromVersion()} to {@code fromVersion() + 1}.
 *
 * <p>Implementations receive the row as a mutable JSON object and may modify it in place
 * or return a replacement. They must be deterministic, since a step interrupted by a
 * crash is rolled back and re-run on the next open.
 */
public interface SchemaMigration {

  EntityType<?> collection();

  int fromVersion();

  default int toVersion() {
    return fromVersion() + 1;
  }

  /**
   * Short human readable summary, used in logs.
   */
  String description();

  /**
   * Migrates one row.
   *
   * @param row the stored row at {@link #fromVersion()}
   * @return the row at {@link #toVersion()}
   */
  ObjectNode migrate(ObjectNode row);
}
