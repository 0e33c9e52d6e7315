package notestore.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of the sync queue: a record that a local mutation happened and still has to be
 * delivered to the remote backend.
 *
 * <p>{@code dataJson} is the full stored row for {@code create}, the applied patch for
 * {@code update}, and {@code null} for {@code delete}.
 *
 * @see notestore.spi.SyncQueue
 */
public record SyncOperation(
    String id,
    SyncOperationType type,
    String table,
    String itemId,
    String dataJson,
    Instant timestamp
) {
  public SyncOperation {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(itemId, "itemId");
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
