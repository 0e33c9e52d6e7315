package notestore.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import notestore.EntityType;

/**
 * rehearsal_sessions 1 to 2: progress fields became mandatory.
 */
final class RehearsalSessionDefaultsMigration implements SchemaMigration {

  @Override
  public EntityType<?> collection() {
    return EntityType.REHEARSAL_SESSIONS;
  }

  @Override
  public int fromVersion() {
    return 1;
  }

  @Override
  public String description() {
    return "rehearsal_sessions: default progress fields";
  }

  @Override
  public ObjectNode migrate(ObjectNode row) {
    if (!row.hasNonNull("totalDuration")) {
      row.put("totalDuration", 0);
    }
    if (!row.hasNonNull("currentNoteIndex")) {
      row.put("currentNoteIndex", 0);
    }
    if (!row.hasNonNull("noteTimings")) {
      row.putArray("noteTimings");
    }
    if (!row.hasNonNull("isCompleted")) {
      row.put("isCompleted", false);
    }
    return row;
  }
}
