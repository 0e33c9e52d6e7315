package notestore.service;

import notestore.EntityType;
import notestore.ListOptions;
import notestore.Patch;
import notestore.SortOrder;
import notestore.domain.RehearsalSession;
import notestore.spi.EntityStore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class RehearsalSessionService {
  private static final String DEFAULT_SORT = "startTime";

  private final EntityStore store;

  public RehearsalSessionService(EntityStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  public Result<RehearsalSession> create(RehearsalSession session) {
    return Result.of(() -> store.create(EntityType.REHEARSAL_SESSIONS, session));
  }

  public Optional<RehearsalSession> get(String id) {
    return store.read(EntityType.REHEARSAL_SESSIONS, id);
  }

  public Result<RehearsalSession> update(String id, Patch patch) {
    return Result.of(() -> store.update(EntityType.REHEARSAL_SESSIONS, id, patch));
  }

  public void delete(String id) {
    store.delete(EntityType.REHEARSAL_SESSIONS, id);
  }

  public List<RehearsalSession> list(ListOptions options) {
    return store.list(EntityType.REHEARSAL_SESSIONS, options);
  }

  /**
   * All sessions, latest start first.
   */
  public List<RehearsalSession> list() {
    return list(ListOptions.builder().sortBy(DEFAULT_SORT, SortOrder.DESC).build());
  }

  public List<RehearsalSession> listForSetList(String setListId) {
    return list(ListOptions.builder()
        .filter("setListId", setListId)
        .sortBy(DEFAULT_SORT, SortOrder.DESC)
        .build());
  }
}
