package notestore;

/**
 * Thrown when a row is inserted under a key that is already taken.
 */
public class DuplicateEntityException extends ValidationException {

  public DuplicateEntityException(String message, Throwable cause) {
    super(message, cause);
  }
}
