package notestore.service;

import notestore.Entity;
import notestore.EntityType;
import notestore.SearchQuery;
import notestore.StoreException;
import notestore.spi.EntityStore;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Fans one text query out to every searchable collection concurrently and gathers the
 * per-collection results.
 *
 * <p>Searched fields: notes by content and tags, set lists by name, venues by name and
 * location, contacts by name and role, performances by notes.
 */
public final class GlobalSearch {
  private static final String[] SETLIST_FIELDS = {"name"};

  private final EntityStore store;
  private final Executor executor;

  public GlobalSearch(EntityStore store, Executor executor) {
    this.store = Objects.requireNonNull(store, "store");
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /**
   * Searches all collections.
   *
   * @param limit per-collection result limit, or {@code null} for none
   */
  public GlobalSearchResult search(String text, Integer limit) {
    var notes = searchAsync(EntityType.NOTES, text, limit, NoteService.SEARCH_FIELDS);
    var setlists = searchAsync(EntityType.SETLISTS, text, limit, SETLIST_FIELDS);
    var venues = searchAsync(EntityType.VENUES, text, limit, VenueService.SEARCH_FIELDS);
    var contacts = searchAsync(EntityType.CONTACTS, text, limit, ContactService.SEARCH_FIELDS);
    var performances = searchAsync(EntityType.PERFORMANCES, text, limit, PerformanceService.SEARCH_FIELDS);
    try {
      CompletableFuture.allOf(notes, setlists, venues, contacts, performances).join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof StoreException storeException) {
        throw storeException;
      }
      throw e;
    }
    return new GlobalSearchResult(notes.join(), setlists.join(), venues.join(), contacts.join(),
        performances.join());
  }

  private <T extends Entity> CompletableFuture<List<T>> searchAsync(
      EntityType<T> type, String text, Integer limit, String[] fields) {
    SearchQuery.Builder query = SearchQuery.builder().text(text).fields(fields);
    if (limit != null) {
      query.limit(limit);
    }
    SearchQuery built = query.build();
    return CompletableFuture.supplyAsync(() -> store.search(type, built), executor);
  }
}
