package notestore;

/**
 * Thrown when a schema migration step fails. The store refuses to open afterwards.
 */
public class SchemaMigrationException extends StorageUnavailableException {

  public SchemaMigrationException(String message) {
    super(message);
  }

  public SchemaMigrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
