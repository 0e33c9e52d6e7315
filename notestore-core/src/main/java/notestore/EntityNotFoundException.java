package notestore;

/**
 * Thrown when an operation that requires an existing entity finds none.
 *
 * <p>Plain reads never throw this; they return an empty {@link java.util.Optional}.
 */
public class EntityNotFoundException extends StoreException {
  private final String collection;
  private final String id;

  public EntityNotFoundException(EntityType<?> type, String id) {
    this(type.name(), id, "No " + type.name() + " entity with id " + id);
  }

  public EntityNotFoundException(String collection, String id, String message) {
    super(message);
    this.collection = collection;
    this.id = id;
  }

  public String collection() {
    return collection;
  }

  public String id() {
    return id;
  }
}
