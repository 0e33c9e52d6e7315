package notestore.spi;

import notestore.model.SyncOperation;

import java.util.List;

/**
 * Durable, append-only outbox of local mutations awaiting delivery to the remote backend.
 *
 * <p>The sync collaborator polls {@link #pending()}, delivers entries in the returned
 * order, and acknowledges each delivered entry with {@link #remove(String)}. Retry and
 * backoff are the collaborator's business.
 */
public interface SyncQueue {

  /**
   * Appends an entry. Failures are logged and swallowed so that the triggering mutation,
   * which has already been persisted, still succeeds.
   */
  void append(SyncOperation operation);

  /**
   * Appends entries in order, with the same failure handling as {@link #append}.
   */
  void appendAll(List<SyncOperation> operations);

  /**
   * All entries ordered by timestamp ascending, ties broken by append order.
   */
  List<SyncOperation> pending();

  /**
   * Acknowledges a delivered entry. Removing an unknown id is not an error.
   */
  void remove(String operationId);

  void clear();

  int size();
}
