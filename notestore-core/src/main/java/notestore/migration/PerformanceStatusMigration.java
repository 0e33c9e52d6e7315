package notestore.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import notestore.EntityType;

/**
 * performances 1 to 2: {@code status} became mandatory, defaulting to {@code scheduled}.
 */
final class PerformanceStatusMigration implements SchemaMigration {

  @Override
  public EntityType<?> collection() {
    return EntityType.PERFORMANCES;
  }

  @Override
  public int fromVersion() {
    return 1;
  }

  @Override
  public String description() {
    return "performances: default status";
  }

  @Override
  public ObjectNode migrate(ObjectNode row) {
    if (!row.hasNonNull("status")) {
      row.put("status", "scheduled");
    }
    return row;
  }
}
