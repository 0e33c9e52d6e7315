package notestore;

/**
 * Thrown when the underlying storage cannot serve a request: the database is closed,
 * the disk is full, or a statement failed for reasons outside the caller's control.
 *
 * <p>Not recoverable at the call site; callers are expected to escalate.
 */
public class StorageUnavailableException extends StoreException {

  public StorageUnavailableException(String message) {
    super(message);
  }

  public StorageUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
