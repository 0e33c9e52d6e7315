package notestore;

/**
 * Base class of all unchecked exceptions thrown by the entity store and its components.
 */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
