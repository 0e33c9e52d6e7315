package notestore.service;

import notestore.EntityType;
import notestore.ListOptions;
import notestore.Patch;
import notestore.SortOrder;
import notestore.domain.Performance;
import notestore.domain.PerformanceFeedback;
import notestore.domain.Venue;
import notestore.domain.VenuePerformance;
import notestore.spi.EntityStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Venues and their performance history.
 */
public final class VenueService {
  static final String[] SEARCH_FIELDS = {"name", "location"};

  private final EntityStore store;

  public VenueService(EntityStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  public Result<Venue> create(Venue venue) {
    return Result.of(() -> store.create(EntityType.VENUES, venue));
  }

  public Optional<Venue> get(String id) {
    return store.read(EntityType.VENUES, id);
  }

  public Result<Venue> update(String id, Patch patch) {
    return Result.of(() -> store.update(EntityType.VENUES, id, patch));
  }

  public void delete(String id) {
    store.delete(EntityType.VENUES, id);
  }

  public List<Venue> list(ListOptions options) {
    return store.list(EntityType.VENUES, options);
  }

  /**
   * All venues sorted by name.
   */
  public List<Venue> list() {
    return list(ListOptions.builder().sortBy("name", SortOrder.ASC).build());
  }

  /**
   * Adds a summary of a performance to the venue's history, once per performance.
   */
  public Result<Venue> linkPerformance(String performanceId, String venueId) {
    Optional<Performance> performance = store.read(EntityType.PERFORMANCES, performanceId);
    Optional<Venue> venue = get(venueId);
    if (performance.isEmpty() || venue.isEmpty()) {
      return Result.notFound("Performance or venue not found");
    }
    List<VenuePerformance> history = new ArrayList<>(venue.get().performanceHistory());
    if (history.stream().anyMatch(entry -> entry.id().equals(performanceId))) {
      return Result.ok(venue.get());
    }
    Performance p = performance.get();
    PerformanceFeedback feedback = p.feedback();
    history.add(new VenuePerformance(
        p.id(),
        p.setListId(),
        p.date(),
        p.actualDuration() == null ? 0 : p.actualDuration(),
        feedback == null ? null : feedback.audienceSize(),
        feedback == null ? null : feedback.rating(),
        p.notes(),
        p.createdAt()));
    return update(venueId, Patch.of("performanceHistory", history));
  }

  public Result<Venue> unlinkPerformance(String performanceId, String venueId) {
    Optional<Venue> venue = get(venueId);
    if (venue.isEmpty()) {
      return Result.notFound("Venue not found");
    }
    List<VenuePerformance> history = new ArrayList<>(venue.get().performanceHistory());
    history.removeIf(entry -> entry.id().equals(performanceId));
    return update(venueId, Patch.of("performanceHistory", history));
  }
}
