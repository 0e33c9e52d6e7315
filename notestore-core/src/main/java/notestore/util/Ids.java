package notestore.util;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.UUID;

/**
 * Identifier generation for entities, sync operations and blobs.
 */
public final class Ids {

  private Ids() {}

  /**
   * Random UUID, the id format every entity collection validates against.
   */
  public static String newEntityId() {
    return UUID.randomUUID().toString();
  }

  /**
   * Monotonic ULID: strictly increasing within this JVM, lexically sortable by time.
   */
  public static String newSyncOperationId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  /**
   * Blob key of the form {@code <kind>_<ULID>}, sorting by creation time within a kind.
   */
  public static String newBlobKey(String kind) {
    return kind + "_" + UlidCreator.getMonotonicUlid();
  }
}
