package notestore.service;

import notestore.EntityType;
import notestore.ListOptions;
import notestore.Patch;
import notestore.SearchQuery;
import notestore.domain.Attachment;
import notestore.domain.Note;
import notestore.media.ImageCompressor;
import notestore.media.MediaStorage;
import notestore.spi.EntityStore;
import notestore.util.Ids;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Notes and their media.
 *
 * <p>Deleting a note first deletes every blob its attachments point at, then the note row.
 * The two steps are not atomic: a crash in between leaves the row with attachments whose
 * blobs are already gone, which readers treat like any other missing blob.
 */
public final class NoteService {
  private static final Logger logger = Logger.getLogger(NoteService.class.getName());

  static final String[] SEARCH_FIELDS = {"content", "tags"};

  private final EntityStore store;
  private final MediaStorage media;

  public NoteService(EntityStore store, MediaStorage media) {
    this.store = Objects.requireNonNull(store, "store");
    this.media = Objects.requireNonNull(media, "media");
  }

  public Result<Note> create(Note note) {
    return Result.of(() -> store.create(EntityType.NOTES, note));
  }

  public Result<List<Note>> createMany(List<Note> notes) {
    return Result.of(() -> store.createMany(EntityType.NOTES, notes));
  }

  public Optional<Note> get(String id) {
    return store.read(EntityType.NOTES, id);
  }

  public Result<Note> update(String id, Patch patch) {
    return Result.of(() -> store.update(EntityType.NOTES, id, patch));
  }

  /**
   * Deletes a note and the blobs of its attachments. Deleting a missing note is a no-op
   * apart from the sync entry.
   */
  public void delete(String id) {
    store.read(EntityType.NOTES, id).ifPresent(this::deleteAttachmentBlobs);
    store.delete(EntityType.NOTES, id);
  }

  /**
   * Deletes notes and their attachment blobs. All blobs go first, then all rows in one batch.
   */
  public void deleteMany(Collection<String> ids) {
    for (String id : ids) {
      store.read(EntityType.NOTES, id).ifPresent(this::deleteAttachmentBlobs);
    }
    store.deleteMany(EntityType.NOTES, ids);
  }

  /**
   * Deletes note rows but leaves their attachment blobs in place, for callers that moved
   * the attachments to another note first.
   */
  public void deleteRetainingMedia(Collection<String> ids) {
    store.deleteMany(EntityType.NOTES, ids);
  }

  /**
   * Lists notes, newest first unless the options say otherwise.
   */
  public List<Note> list(ListOptions options) {
    return store.list(EntityType.NOTES, options);
  }

  public List<Note> list() {
    return list(ListOptions.defaults());
  }

  /**
   * Substring search over content and tags.
   */
  public List<Note> search(String text, Integer limit) {
    SearchQuery.Builder query = SearchQuery.builder().text(text).fields(SEARCH_FIELDS);
    if (limit != null) {
      query.limit(limit);
    }
    return store.search(EntityType.NOTES, query.build());
  }

  public String storeAudio(byte[] audio, String mimeType) {
    return media.storeAudio(audio, mimeType);
  }

  public String storeImage(byte[] image) {
    return media.storeImage(image);
  }

  public Optional<byte[]> getMedia(String key) {
    return media.getMedia(key);
  }

  public void deleteMedia(String key) {
    media.deleteMedia(key);
  }

  /**
   * Stores a recording and attaches it to an existing note.
   *
   * <p>If the note does not exist the stored blob is removed again.
   */
  public Result<Note> attachAudio(String noteId, byte[] audio, String mimeType, String filename) {
    String key = media.storeAudio(audio, mimeType);
    Attachment attachment = new Attachment(Ids.newEntityId(), Attachment.Type.AUDIO, filename,
        mimeType, (long) audio.length, key);
    return attach(noteId, attachment, key);
  }

  /**
   * Compresses and stores an image and attaches it to an existing note.
   */
  public Result<Note> attachImage(String noteId, byte[] image, String filename) {
    MediaStorage.StoredMedia stored = media.storeCompressedImage(image);
    Attachment attachment = new Attachment(Ids.newEntityId(), Attachment.Type.IMAGE, filename,
        ImageCompressor.OUTPUT_MIME_TYPE, stored.size(), stored.key());
    return attach(noteId, attachment, stored.key());
  }

  private Result<Note> attach(String noteId, Attachment attachment, String key) {
    Optional<Note> note = store.read(EntityType.NOTES, noteId);
    if (note.isEmpty()) {
      media.deleteMedia(key);
      return Result.notFound("Note not found");
    }
    List<Attachment> attachments = new ArrayList<>(note.get().attachments());
    attachments.add(attachment);
    Result<Note> result = update(noteId, Patch.of("attachments", attachments));
    if (!result.isOk()) {
      media.deleteMedia(key);
    }
    return result;
  }

  private void deleteAttachmentBlobs(Note note) {
    for (Attachment attachment : note.attachments()) {
      media.deleteMedia(attachment.blobKey());
      logger.log(Level.FINE, "Deleted blob {0} of note {1}",
          new Object[]{attachment.blobKey(), note.id()});
    }
  }
}
