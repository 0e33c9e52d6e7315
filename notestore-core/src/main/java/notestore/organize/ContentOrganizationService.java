package notestore.organize;

import notestore.Patch;
import notestore.StorageUnavailableException;
import notestore.ValidationException;
import notestore.domain.Attachment;
import notestore.domain.Contact;
import notestore.domain.Note;
import notestore.domain.SetList;
import notestore.domain.Venue;
import notestore.service.Result;
import notestore.service.StorageService;
import notestore.util.JsonCodec;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Library-wide maintenance over the domain services: duplicate detection, duration
 * buckets, bulk tag edits, JSON backup and restore, and CSV export.
 */
public final class ContentOrganizationService {
  private static final Logger logger = Logger.getLogger(ContentOrganizationService.class.getName());

  public static final double DEFAULT_DUPLICATE_THRESHOLD = 0.8;
  private static final double MERGE_APPEND_BELOW = 0.8;
  private static final String MERGE_SEPARATOR = "\n\n--- Merged from duplicate ---\n";

  private final StorageService services;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  public ContentOrganizationService(StorageService services) {
    this(services, JsonCodec.getDefault(), Clock.systemUTC());
  }

  public ContentOrganizationService(StorageService services, JsonCodec jsonCodec, Clock clock) {
    this.services = Objects.requireNonNull(services, "services");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Finds groups of similar notes. Each pair is reported once, under the note listed first.
   */
  public List<DuplicateGroup> detectDuplicates(double threshold) {
    List<Note> notes = services.notes().list();
    List<DuplicateGroup> groups = new ArrayList<>();
    for (int i = 0; i < notes.size(); i++) {
      Note original = notes.get(i);
      List<DuplicateGroup.Match> matches = new ArrayList<>();
      for (int j = i + 1; j < notes.size(); j++) {
        Note candidate = notes.get(j);
        double similarity = TextSimilarity.notes(original, candidate);
        if (similarity >= threshold) {
          matches.add(new DuplicateGroup.Match(candidate, similarity,
              TextSimilarity.reasons(original, candidate)));
        }
      }
      if (!matches.isEmpty()) {
        groups.add(new DuplicateGroup(original, matches));
      }
    }
    return groups;
  }

  public List<DuplicateGroup> detectDuplicates() {
    return detectDuplicates(DEFAULT_DUPLICATE_THRESHOLD);
  }

  public DurationGroups categorizeByDuration() {
    List<Note> shortNotes = new ArrayList<>();
    List<Note> mediumNotes = new ArrayList<>();
    List<Note> longNotes = new ArrayList<>();
    for (Note note : services.notes().list()) {
      switch (DurationEstimator.categorize(DurationEstimator.durationOf(note))) {
        case SHORT -> shortNotes.add(note);
        case MEDIUM -> mediumNotes.add(note);
        case LONG -> longNotes.add(note);
      }
    }
    return new DurationGroups(shortNotes, mediumNotes, longNotes);
  }

  /**
   * Deletes notes with their attachment blobs.
   */
  public BulkOperationResult bulkDeleteNotes(Collection<String> noteIds) {
    try {
      services.notes().deleteMany(noteIds);
      return BulkOperationResult.of(noteIds.size(), List.of());
    } catch (StorageUnavailableException e) {
      logger.log(Level.WARNING, "Bulk delete of " + noteIds.size() + " notes failed", e);
      return BulkOperationResult.of(0, List.of("Failed to delete notes: " + e.getMessage()));
    }
  }

  /**
   * Adds tags to every listed note that exists, keeping existing tag order.
   */
  public BulkOperationResult bulkAddTags(Collection<String> noteIds, List<String> tags) {
    return editTags(noteIds, current -> {
      Set<String> merged = new LinkedHashSet<>(current);
      merged.addAll(tags);
      return new ArrayList<>(merged);
    });
  }

  public BulkOperationResult bulkRemoveTags(Collection<String> noteIds, List<String> tags) {
    return editTags(noteIds, current -> {
      List<String> remaining = new ArrayList<>(current);
      remaining.removeAll(tags);
      return remaining;
    });
  }

  private BulkOperationResult editTags(Collection<String> noteIds,
      Function<List<String>, List<String>> edit) {
    List<String> errors = new ArrayList<>();
    int processed = 0;
    for (String noteId : noteIds) {
      Optional<Note> note = services.notes().get(noteId);
      if (note.isEmpty()) {
        continue;
      }
      Result<Note> result = services.notes().update(noteId, Patch.of("tags", edit.apply(note.get().tags())));
      if (result.isOk()) {
        processed++;
      } else {
        errors.add("Failed to update note " + noteId + ": " + describe(result));
      }
    }
    return BulkOperationResult.of(processed, errors);
  }

  /**
   * Folds duplicates into the original note: tags and attachments are unioned, content of
   * clearly different duplicates is appended, then the duplicate rows are deleted.
   *
   * <p>The duplicates' blobs are kept, since their attachments now belong to the original.
   */
  public Result<Note> mergeDuplicateNotes(String originalId, List<String> duplicateIds) {
    Optional<Note> original = services.notes().get(originalId);
    if (original.isEmpty()) {
      return Result.notFound("Original note not found");
    }
    Set<String> tags = new LinkedHashSet<>(original.get().tags());
    List<Attachment> attachments = new ArrayList<>(original.get().attachments());
    StringBuilder content = new StringBuilder(original.get().content());
    List<String> merged = new ArrayList<>();
    for (String duplicateId : duplicateIds) {
      Optional<Note> duplicate = services.notes().get(duplicateId);
      if (duplicate.isEmpty() || duplicateId.equals(originalId)) {
        continue;
      }
      merged.add(duplicateId);
      tags.addAll(duplicate.get().tags());
      for (Attachment attachment : duplicate.get().attachments()) {
        if (attachments.stream().noneMatch(a -> a.id().equals(attachment.id()))) {
          attachments.add(attachment);
        }
      }
      if (TextSimilarity.text(original.get().content(), duplicate.get().content()) < MERGE_APPEND_BELOW) {
        content.append(MERGE_SEPARATOR).append(duplicate.get().content());
      }
    }
    Result<Note> updated = services.notes().update(originalId, Patch.builder()
        .set("content", content.toString())
        .set("tags", new ArrayList<>(tags))
        .set("attachments", attachments)
        .build());
    if (updated.isOk()) {
      services.notes().deleteRetainingMedia(merged);
    }
    return updated;
  }

  public ExportSnapshot exportToJson() {
    return new ExportSnapshot(
        services.notes().list(),
        services.setLists().list(),
        services.venues().list(),
        services.contacts().list(),
        clock.instant(),
        ExportSnapshot.FORMAT_VERSION);
  }

  public String writeJson(ExportSnapshot snapshot) {
    return jsonCodec.toJson(snapshot);
  }

  /**
   * @throws ValidationException if the text is not a snapshot
   */
  public ExportSnapshot readJson(String json) {
    return jsonCodec.read(json, ExportSnapshot.class);
  }

  public String exportToCsv(CsvExportType type) {
    CsvWriter csv = new CsvWriter().row(type.headers());
    switch (type) {
      case NOTES -> services.notes().list().forEach(note -> csv.row(List.of(
          note.id(), note.content(), jsonCodec.toTree(note.captureMethod()).asText(),
          String.join(", ", note.tags()), orEmpty(note.venue()), orEmpty(note.audience()),
          orEmpty(note.estimatedDuration()), note.createdAt(), note.updatedAt())));
      case SETLISTS -> services.setLists().list().forEach(setList -> csv.row(List.of(
          setList.id(), setList.name(), setList.totalDuration(), setList.notes().size(),
          orEmpty(setList.venue()), orEmpty(setList.performanceDate()), setList.createdAt())));
      case VENUES -> services.venues().list().forEach(venue -> csv.row(List.of(
          venue.id(), venue.name(), venue.location(),
          orEmpty(venue.characteristics().audienceSize()),
          orEmpty(venue.characteristics().audienceType()),
          enumValue(venue.characteristics().acoustics()),
          enumValue(venue.characteristics().lighting()), venue.createdAt())));
      case CONTACTS -> services.contacts().list().forEach(contact -> csv.row(List.of(
          contact.id(), contact.name(), contact.role(), orEmpty(contact.venue()),
          orEmpty(contact.contactInfo().email()), orEmpty(contact.contactInfo().phone()),
          contact.createdAt())));
    }
    return csv.toString();
  }

  /**
   * Imports a snapshot as new rows: notes, then venues, contacts and finally set lists.
   *
   * <p>Imported rows get fresh ids and timestamps. With {@link ImportOptions#skipDuplicates()} set
   * a row is skipped when the similarity of its primary text exceeds the threshold against an
   * existing row (or one imported earlier in the same run): note content; venue name and
   * location; contact name with the same email; set list name.
   */
  public ImportResult importFromJson(ExportSnapshot snapshot, ImportOptions options) {
    List<String> errors = new ArrayList<>();
    int[] duplicates = new int[1];
    double threshold = options.similarityThreshold();

    List<Note> existingNotes = options.skipDuplicates() ? new ArrayList<>(services.notes().list()) : new ArrayList<>();
    int notes = importRows(snapshot.notes(), "note", options, errors, duplicates,
        note -> existingNotes.stream().anyMatch(e -> TextSimilarity.label(e.content(), note.content()) > threshold),
        note -> services.notes().create(note.toBuilder()
            .id(null).createdAt(null).updatedAt(null).build()),
        existingNotes::add);

    List<Venue> existingVenues = options.skipDuplicates() ? new ArrayList<>(services.venues().list()) : new ArrayList<>();
    int venues = importRows(snapshot.venues(), "venue", options, errors, duplicates,
        venue -> existingVenues.stream().anyMatch(e ->
            TextSimilarity.label(e.name() + " " + e.location(), venue.name() + " " + venue.location()) > threshold),
        venue -> services.venues().create(venue.toBuilder()
            .id(null).createdAt(null).updatedAt(null)
            .contacts(List.of()).performanceHistory(List.of()).build()),
        existingVenues::add);

    List<Contact> existingContacts = options.skipDuplicates() ? new ArrayList<>(services.contacts().list()) : new ArrayList<>();
    int contacts = importRows(snapshot.contacts(), "contact", options, errors, duplicates,
        contact -> existingContacts.stream().anyMatch(e ->
            TextSimilarity.label(e.name(), contact.name()) > threshold
                && Objects.equals(e.contactInfo().email(), contact.contactInfo().email())),
        contact -> services.contacts().create(contact.toBuilder()
            .id(null).createdAt(null).updatedAt(null).build()),
        existingContacts::add);

    List<SetList> existingSetLists = options.skipDuplicates() ? new ArrayList<>(services.setLists().list()) : new ArrayList<>();
    int setlists = importRows(snapshot.setlists(), "setlist", options, errors, duplicates,
        setList -> existingSetLists.stream().anyMatch(e -> TextSimilarity.label(e.name(), setList.name()) > threshold),
        setList -> services.setLists().create(setList.toBuilder()
            .id(null).createdAt(null).updatedAt(null).build()),
        existingSetLists::add);

    logger.log(Level.INFO, "Imported {0} notes, {1} set lists, {2} venues, {3} contacts ({4} duplicates skipped)",
        new Object[]{notes, setlists, venues, contacts, duplicates[0]});
    return new ImportResult(errors.isEmpty(), new ImportResult.Counts(notes, setlists, venues, contacts),
        errors, duplicates[0]);
  }

  private static <T> int importRows(List<T> rows, String kind, ImportOptions options,
      List<String> errors, int[] duplicates, Predicate<T> isDuplicate,
      Function<T, Result<T>> create, Consumer<T> onImported) {
    int imported = 0;
    for (T row : rows) {
      if (options.skipDuplicates() && isDuplicate.test(row)) {
        duplicates[0]++;
        continue;
      }
      Result<T> result = create.apply(row);
      if (result instanceof Result.Ok<T> ok) {
        onImported.accept(ok.value());
        imported++;
      } else {
        errors.add("Failed to import " + kind + ": " + describe(result));
      }
    }
    return imported;
  }

  private String enumValue(Enum<?> value) {
    return value == null ? "" : jsonCodec.toTree(value).asText();
  }

  private static Object orEmpty(Object value) {
    return value == null ? "" : value;
  }

  private static String describe(Result<?> result) {
    if (result instanceof Result.NotFound<?> notFound) {
      return notFound.message();
    }
    if (result instanceof Result.Invalid<?> invalid) {
      return invalid.message();
    }
    return String.valueOf(result);
  }
}
