package notestore.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import notestore.EntityType;

/**
 * notes 1 to 2: the capture kind moved from {@code type} to {@code captureMethod}.
 *
 * <p>Version 1 also allowed {@code mixed}, which no longer exists; such notes become
 * {@code text}.
 */
final class NoteCaptureMethodMigration implements SchemaMigration {

  @Override
  public EntityType<?> collection() {
    return EntityType.NOTES;
  }

  @Override
  public int fromVersion() {
    return 1;
  }

  @Override
  public String description() {
    return "notes: rename type to captureMethod";
  }

  @Override
  public ObjectNode migrate(ObjectNode row) {
    JsonNode legacy = row.remove("type");
    if (!row.hasNonNull("captureMethod")) {
      String method = legacy == null || !legacy.isTextual() ? "text" : legacy.asText();
      row.put("captureMethod", "mixed".equals(method) ? "text" : method);
    }
    return row;
  }
}
