package notestore.spi;

import notestore.Entity;
import notestore.EntityType;
import notestore.ListOptions;
import notestore.Patch;
import notestore.SearchQuery;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Generic CRUD, list and search over typed collections.
 *
 * <p>Every successful mutation appends one {@link notestore.model.SyncOperation} per
 * affected row to the {@link SyncQueue} after the row is persisted. A failure to append is
 * logged and swallowed; it never fails the mutation.
 *
 * <p>Calls block on I/O and either complete or throw:
 * <ul>
 *   <li>{@link notestore.ValidationException} when a value violates its collection's constraints</li>
 *   <li>{@link notestore.EntityNotFoundException} when an update targets a missing row</li>
 *   <li>{@link notestore.StorageUnavailableException} when the backing database fails</li>
 * </ul>
 *
 * <p>Single-row calls are atomic for their row. There is no locking between calls, so two
 * concurrent read-modify-write sequences on the same row can lose an update.
 */
public interface EntityStore {

  /**
   * Persists a new entity. A missing {@code id} is generated, missing timestamps are set to
   * the current time.
   *
   * @return the stored entity, as a subsequent {@link #read} would return it
   */
  <T extends Entity> T create(EntityType<T> type, T item);

  <T extends Entity> Optional<T> read(EntityType<T> type, String id);

  /**
   * Applies a patch to an existing entity and advances {@code updatedAt}.
   *
   * @return the entity after the update
   * @throws notestore.EntityNotFoundException if no entity has the given id
   */
  <T extends Entity> T update(EntityType<T> type, String id, Patch patch);

  /**
   * Removes an entity. Deleting a missing id is not an error.
   */
  <T extends Entity> void delete(EntityType<T> type, String id);

  <T extends Entity> List<T> list(EntityType<T> type, ListOptions options);

  default <T extends Entity> List<T> list(EntityType<T> type) {
    return list(type, ListOptions.defaults());
  }

  <T extends Entity> List<T> search(EntityType<T> type, SearchQuery query);

  /**
   * Creates all items in one storage transaction.
   *
   * @return the stored entities in input order
   */
  <T extends Entity> List<T> createMany(EntityType<T> type, List<T> items);

  <T extends Entity> void deleteMany(EntityType<T> type, Collection<String> ids);

  <T extends Entity> long count(EntityType<T> type);

  /**
   * Removes every entity of every collection, the whole sync queue and all blobs.
   */
  void clear();
}
