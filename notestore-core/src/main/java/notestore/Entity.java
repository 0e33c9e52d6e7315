package notestore;

import java.time.Instant;

/**
 * A domain record stored in one collection of the entity store.
 *
 * <p>The store treats entities as opaque payloads apart from the bookkeeping fields
 * declared here. {@code id} is generated on creation when absent; {@code createdAt}
 * and {@code updatedAt} are maintained by the store and never satisfy
 * {@code updatedAt < createdAt}.
 *
 * @see EntityType
 */
public interface Entity {

  /**
   * Opaque unique identifier, a random UUID unless supplied by the caller.
   */
  String id();

  Instant createdAt();

  Instant updatedAt();

  /**
   * Optional schema bookkeeping number. Not used for optimistic locking.
   *
   * @return the version, or {@code null} when not recorded
   */
  Integer version();
}
