package notestore.service;

import com.fasterxml.jackson.core.type.TypeReference;
import notestore.EntityType;
import notestore.ListOptions;
import notestore.Patch;
import notestore.domain.Note;
import notestore.domain.SetList;
import notestore.spi.EntityStore;
import notestore.util.JsonCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Set lists with a derived {@code totalDuration}.
 *
 * <p>Every create, and every update touching {@code notes}, recomputes the total as the sum
 * of the member notes' declared durations before writing. A {@code totalDuration} supplied
 * by the caller is ignored.
 */
public final class SetListService {
  private static final TypeReference<List<Note>> NOTE_LIST = new TypeReference<>() {};
  private static final String NOTES_FIELD = "notes";
  private static final String TOTAL_FIELD = "totalDuration";

  private final EntityStore store;
  private final JsonCodec jsonCodec;

  public SetListService(EntityStore store, JsonCodec jsonCodec) {
    this.store = Objects.requireNonNull(store, "store");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Sum of the members' {@code metadata.duration}, missing durations counting as zero.
   */
  public static double totalDuration(List<Note> notes) {
    double total = 0;
    for (Note note : notes) {
      total += note.declaredDuration();
    }
    return total;
  }

  public Result<SetList> create(SetList setList) {
    SetList withTotal = setList.toBuilder().totalDuration(totalDuration(setList.notes())).build();
    return Result.of(() -> store.create(EntityType.SETLISTS, withTotal));
  }

  public Optional<SetList> get(String id) {
    return store.read(EntityType.SETLISTS, id);
  }

  public Result<SetList> update(String id, Patch patch) {
    return Result.of(() -> store.update(EntityType.SETLISTS, id, withDerivedTotal(patch)));
  }

  public void delete(String id) {
    store.delete(EntityType.SETLISTS, id);
  }

  public List<SetList> list(ListOptions options) {
    return store.list(EntityType.SETLISTS, options);
  }

  public List<SetList> list() {
    return list(ListOptions.defaults());
  }

  /**
   * Appends a note snapshot to a set list. Read-modify-write without locking.
   */
  public Result<SetList> addNote(String setListId, Note note) {
    Optional<SetList> current = get(setListId);
    if (current.isEmpty()) {
      return Result.notFound("Set list not found");
    }
    List<Note> notes = new ArrayList<>(current.get().notes());
    notes.add(note);
    return update(setListId, Patch.of(NOTES_FIELD, notes));
  }

  /**
   * Removes every snapshot of a note from a set list. Read-modify-write without locking.
   */
  public Result<SetList> removeNote(String setListId, String noteId) {
    Optional<SetList> current = get(setListId);
    if (current.isEmpty()) {
      return Result.notFound("Set list not found");
    }
    List<Note> notes = new ArrayList<>(current.get().notes());
    notes.removeIf(note -> noteId.equals(note.id()));
    return update(setListId, Patch.of(NOTES_FIELD, notes));
  }

  private Patch withDerivedTotal(Patch patch) {
    if (!patch.touches(NOTES_FIELD)) {
      return patch.touches(TOTAL_FIELD) ? patch.toBuilder().remove(TOTAL_FIELD).build() : patch;
    }
    Object notes = patch.values().get(NOTES_FIELD);
    double total = notes == null ? 0 : totalDuration(jsonCodec.convert(notes, NOTE_LIST));
    return patch.toBuilder().set(TOTAL_FIELD, total).build();
  }
}
