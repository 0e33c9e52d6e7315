package notestore;

import notestore.domain.Contact;
import notestore.domain.Note;
import notestore.domain.Performance;
import notestore.domain.RehearsalSession;
import notestore.domain.SetList;
import notestore.domain.Venue;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed identifier of a collection: binds a collection name to the record type stored in it.
 *
 * <p>All collections known to the store are declared as constants, so callers address
 * collections at compile time instead of by free-form strings.
 *
 * @param <T> the entity record type
 */
public final class EntityType<T extends Entity> {
  public static final EntityType<Note> NOTES = new EntityType<>("notes", Note.class);
  public static final EntityType<SetList> SETLISTS = new EntityType<>("setlists", SetList.class);
  public static final EntityType<Venue> VENUES = new EntityType<>("venues", Venue.class);
  public static final EntityType<Contact> CONTACTS = new EntityType<>("contacts", Contact.class);
  public static final EntityType<RehearsalSession> REHEARSAL_SESSIONS =
      new EntityType<>("rehearsal_sessions", RehearsalSession.class);
  public static final EntityType<Performance> PERFORMANCES =
      new EntityType<>("performances", Performance.class);

  private static final List<EntityType<?>> VALUES =
      List.of(NOTES, SETLISTS, VENUES, CONTACTS, REHEARSAL_SESSIONS, PERFORMANCES);

  private final String name;
  private final Class<T> javaType;

  private EntityType(String name, Class<T> javaType) {
    this.name = name;
    this.javaType = javaType;
  }

  /**
   * Collection name, also used as the table name and as {@code table} in sync operations.
   */
  public String name() {
    return name;
  }

  public Class<T> javaType() {
    return javaType;
  }

  /**
   * All collections in declaration order.
   */
  public static List<EntityType<?>> values() {
    return VALUES;
  }

  /**
   * Resolves a collection by its name, for data read back from storage or sync payloads.
   */
  public static Optional<EntityType<?>> byName(String name) {
    Objects.requireNonNull(name, "name");
    for (EntityType<?> type : VALUES) {
      if (type.name.equals(name)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return name;
  }
}
