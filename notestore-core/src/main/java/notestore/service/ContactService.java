package notestore.service;

import notestore.EntityType;
import notestore.ListOptions;
import notestore.Patch;
import notestore.SortOrder;
import notestore.domain.Contact;
import notestore.domain.Interaction;
import notestore.domain.Reminder;
import notestore.spi.EntityStore;
import notestore.util.Ids;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Contacts with their interaction log and reminders.
 *
 * <p>Adding an interaction or reminder reads the contact, appends to the nested list and
 * writes the whole list back. Nothing serializes these read-modify-write cycles: two
 * concurrent calls for the same contact can both read the same list and the later write
 * wins, dropping the other entry. Sequential calls always keep insertion order.
 */
public final class ContactService {
  static final String NOT_FOUND = "Contact not found";
  static final String[] SEARCH_FIELDS = {"name", "role"};

  private final EntityStore store;
  private final Clock clock;

  public ContactService(EntityStore store, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Result<Contact> create(Contact contact) {
    return Result.of(() -> store.create(EntityType.CONTACTS, contact));
  }

  public Optional<Contact> get(String id) {
    return store.read(EntityType.CONTACTS, id);
  }

  public Result<Contact> update(String id, Patch patch) {
    return Result.of(() -> store.update(EntityType.CONTACTS, id, patch));
  }

  public void delete(String id) {
    store.delete(EntityType.CONTACTS, id);
  }

  /**
   * Lists contacts sorted by name unless the options name another sort field.
   */
  public List<Contact> list(ListOptions options) {
    return store.list(EntityType.CONTACTS, options);
  }

  public List<Contact> list() {
    return list(ListOptions.builder().sortBy("name", SortOrder.ASC).build());
  }

  public List<Contact> listByVenue(String venueId) {
    return list(ListOptions.builder().filter("venue", venueId).sortBy("name", SortOrder.ASC).build());
  }

  /**
   * Appends an interaction. A missing id or {@code createdAt} is filled in.
   */
  public Result<Contact> addInteraction(String contactId, Interaction interaction) {
    Optional<Contact> contact = get(contactId);
    if (contact.isEmpty()) {
      return Result.notFound(NOT_FOUND);
    }
    List<Interaction> interactions = new ArrayList<>(contact.get().interactions());
    interactions.add(new Interaction(
        interaction.id() == null ? Ids.newEntityId() : interaction.id(),
        interaction.type(), interaction.subject(), interaction.notes(), interaction.date(),
        interaction.createdAt() == null ? clock.instant() : interaction.createdAt()));
    return update(contactId, Patch.of("interactions", interactions));
  }

  /**
   * Appends a reminder. A missing id or {@code createdAt} is filled in.
   */
  public Result<Contact> addReminder(String contactId, Reminder reminder) {
    Optional<Contact> contact = get(contactId);
    if (contact.isEmpty()) {
      return Result.notFound(NOT_FOUND);
    }
    List<Reminder> reminders = new ArrayList<>(contact.get().reminders());
    reminders.add(new Reminder(
        reminder.id() == null ? Ids.newEntityId() : reminder.id(),
        reminder.title(), reminder.description(), reminder.dueDate(), reminder.completed(),
        reminder.completedAt(), reminder.priority(), reminder.context(),
        reminder.createdAt() == null ? clock.instant() : reminder.createdAt()));
    return update(contactId, Patch.of("reminders", reminders));
  }

  /**
   * Marks a reminder completed and stamps {@code completedAt}.
   */
  public Result<Contact> completeReminder(String contactId, String reminderId) {
    Optional<Contact> contact = get(contactId);
    if (contact.isEmpty()) {
      return Result.notFound(NOT_FOUND);
    }
    List<Reminder> reminders = new ArrayList<>(contact.get().reminders());
    boolean found = false;
    for (int i = 0; i < reminders.size(); i++) {
      if (reminders.get(i).id().equals(reminderId)) {
        reminders.set(i, reminders.get(i).complete(clock.instant()));
        found = true;
      }
    }
    if (!found) {
      return Result.notFound("Reminder not found");
    }
    return update(contactId, Patch.of("reminders", reminders));
  }
}
