package notestore.service;

import notestore.media.ImageCompressor;
import notestore.media.MediaOptions;
import notestore.media.MediaStorage;
import notestore.model.SyncOperation;
import notestore.spi.BlobStore;
import notestore.spi.EntityStore;
import notestore.spi.SyncQueue;
import notestore.util.DaemonThreadFactory;
import notestore.util.JsonCodec;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the domain service layer: wires the per-collection services over one
 * entity store, blob store and sync queue.
 *
 * <p>Owns the small thread pool used by {@link #globalSearch}; {@link #close()} releases it.
 * The storage components themselves belong to the caller.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (NoteStore store = NoteStore.builder().jdbcUrl(url).build();
 *      StorageService services = new StorageService(store.entities(), store.blobs(), store.syncQueue())) {
 *   Note note = services.notes().create(draft).orElseThrow();
 * }
 * }</pre>
 */
public final class StorageService implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(StorageService.class.getName());
  private static final int SEARCH_THREADS = 5;

  private final EntityStore entities;
  private final SyncQueue syncQueue;
  private final ExecutorService searchExecutor;
  private final NoteService notes;
  private final SetListService setLists;
  private final VenueService venues;
  private final ContactService contacts;
  private final RehearsalSessionService rehearsals;
  private final PerformanceService performances;
  private final GlobalSearch globalSearch;

  public StorageService(EntityStore entities, BlobStore blobs, SyncQueue syncQueue) {
    this(entities, blobs, syncQueue, Clock.systemUTC(), JsonCodec.getDefault(), MediaOptions.defaults());
  }

  public StorageService(EntityStore entities, BlobStore blobs, SyncQueue syncQueue,
      Clock clock, JsonCodec jsonCodec, MediaOptions mediaOptions) {
    this.entities = Objects.requireNonNull(entities, "entities");
    this.syncQueue = Objects.requireNonNull(syncQueue, "syncQueue");
    Objects.requireNonNull(blobs, "blobs");
    this.searchExecutor = Executors.newFixedThreadPool(SEARCH_THREADS,
        new DaemonThreadFactory("notestore-search-"));
    MediaStorage media = new MediaStorage(blobs, new ImageCompressor(), mediaOptions);
    this.notes = new NoteService(entities, media);
    this.setLists = new SetListService(entities, jsonCodec);
    this.venues = new VenueService(entities);
    this.contacts = new ContactService(entities, clock);
    this.rehearsals = new RehearsalSessionService(entities);
    this.performances = new PerformanceService(entities);
    this.globalSearch = new GlobalSearch(entities, searchExecutor);
  }

  public NoteService notes() {
    return notes;
  }

  public SetListService setLists() {
    return setLists;
  }

  public VenueService venues() {
    return venues;
  }

  public ContactService contacts() {
    return contacts;
  }

  public RehearsalSessionService rehearsals() {
    return rehearsals;
  }

  public PerformanceService performances() {
    return performances;
  }

  /**
   * Searches every collection concurrently.
   *
   * @param limit per-collection limit, or {@code null}
   */
  public GlobalSearchResult globalSearch(String text, Integer limit) {
    return globalSearch.search(text, limit);
  }

  public List<SyncOperation> getSyncQueue() {
    return syncQueue.pending();
  }

  public void removeSyncOperation(String operationId) {
    syncQueue.remove(operationId);
  }

  public void clearSyncQueue() {
    syncQueue.clear();
  }

  /**
   * Wipes every collection, the sync queue and all blobs.
   */
  public void clearAllData() {
    entities.clear();
    logger.log(Level.INFO, "Cleared all local data");
  }

  @Override
  public void close() {
    searchExecutor.shutdown();
    try {
      if (!searchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        searchExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      searchExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
