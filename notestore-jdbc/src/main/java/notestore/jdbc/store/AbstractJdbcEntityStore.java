package notestore.jdbc.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import notestore.Entity;
import notestore.EntityNotFoundException;
import notestore.EntityType;
import notestore.ListOptions;
import notestore.Patch;
import notestore.SearchQuery;
import notestore.SortOrder;
import notestore.StorageUnavailableException;
import notestore.ValidationException;
import notestore.jdbc.JdbcTemplate;
import notestore.jdbc.TableNames;
import notestore.jdbc.tx.JdbcTransactionManager;
import notestore.model.SyncOperation;
import notestore.model.SyncOperationType;
import notestore.spi.ConnectionProvider;
import notestore.spi.EntityStore;
import notestore.spi.SyncQueue;
import notestore.util.Ids;
import notestore.util.JsonCodec;
import notestore.util.JsonValues;
import notestore.validation.EntityValidator;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Base JDBC entity store. Each collection lives in its own table holding the entity as a
 * JSON document plus indexed {@code created_at} / {@code updated_at} columns.
 *
 * <p>Every successful mutation appends one {@link SyncOperation} to the {@link SyncQueue}
 * after the row change is durable. Appends never fail the mutation, see
 * {@link SyncQueue#append}.
 *
 * <p>Listing sorted by a timestamp without filters is pushed down to SQL; any other
 * listing, and every search, scans the table and evaluates in memory.
 *
 * @see H2EntityStore
 */
public abstract class AbstractJdbcEntityStore implements EntityStore {
  private static final Map<String, String> SORT_COLUMNS = Map.of(
      "createdAt", "created_at",
      "updatedAt", "updated_at");
  private static final Set<String> IMMUTABLE_FIELDS = Set.of("id", "createdAt");

  private static final JdbcTemplate.RowMapper<StoredRow> ROW_MAPPER =
      rs -> new StoredRow(rs.getString("id"), rs.getString("body"));

  private final ConnectionProvider connectionProvider;
  private final JdbcTransactionManager txManager;
  private final SyncQueue syncQueue;
  private final JsonCodec jsonCodec;
  private final EntityValidator validator;
  private final Clock clock;
  private Instant lastSyncTimestamp = Instant.EPOCH;

  protected AbstractJdbcEntityStore(
      ConnectionProvider connectionProvider,
      SyncQueue syncQueue,
      JsonCodec jsonCodec,
      EntityValidator validator,
      Clock clock
  ) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txManager = new JdbcTransactionManager(connectionProvider);
    this.syncQueue = Objects.requireNonNull(syncQueue, "syncQueue");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Unique identifier for this store (e.g., "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:h2:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Paging suffix appended to a sorted SELECT. The default uses the SQL:2008
   * {@code OFFSET ... ROWS FETCH NEXT ... ROWS ONLY} form.
   *
   * @param limit maximum rows, or {@code null} for no limit
   * @param params list to which the bind values are appended
   */
  protected String pagingClause(int offset, Integer limit, List<Object> params) {
    StringBuilder clause = new StringBuilder();
    if (offset > 0) {
      clause.append(" OFFSET ? ROWS");
      params.add(offset);
    }
    if (limit != null) {
      clause.append(" FETCH NEXT ? ROWS ONLY");
      params.add(limit);
    }
    return clause.toString();
  }

  @Override
  public <T extends Entity> T create(EntityType<T> type, T item) {
    Objects.requireNonNull(item, "item");
    T stored = prepareNew(type, item, clock.instant());
    String body = jsonCodec.toJson(stored);
    try (Connection conn = connectionProvider.getConnection()) {
      JdbcTemplate.update(conn, insertSql(type), insertParams(stored, body));
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to create " + type + " entity", e);
    }
    syncQueue.append(syncOperation(SyncOperationType.CREATE, type, stored.id(), body));
    return stored;
  }

  @Override
  public <T extends Entity> Optional<T> read(EntityType<T> type, String id) {
    Objects.requireNonNull(id, "id");
    try (Connection conn = connectionProvider.getConnection()) {
      return selectRow(conn, type, id).map(row -> decode(type, row));
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to read " + type + " entity " + id, e);
    }
  }

  @Override
  public <T extends Entity> T update(EntityType<T> type, String id, Patch patch) {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(patch, "patch");
    for (String field : IMMUTABLE_FIELDS) {
      if (patch.unset().contains(field)) {
        throw new ValidationException(field, "cannot be removed");
      }
    }
    ObjectNode changes = jsonCodec.toObject(patch.values());
    if (changes.has("id") && !id.equals(changes.get("id").asText())) {
      throw new ValidationException("id", "cannot be changed");
    }
    if (changes.has("createdAt")) {
      throw new ValidationException("createdAt", "cannot be changed");
    }
    changes.remove("id");

    T updated;
    ObjectNode syncData = changes.deepCopy();
    try (Connection conn = connectionProvider.getConnection()) {
      StoredRow row = selectRow(conn, type, id)
          .orElseThrow(() -> new EntityNotFoundException(type, id));
      ObjectNode node = parseObject(type, row);
      Instant now = clock.instant();
      Instant previous = instantField(node, "updatedAt");
      Instant updatedAt = previous != null && previous.isAfter(now) ? previous : now;

      node.setAll(changes);
      patch.unset().forEach(node::remove);
      node.put("updatedAt", updatedAt.toString());
      updated = validator.validate(jsonCodec.fromTree(node, type.javaType()));

      int rows = JdbcTemplate.update(conn,
          "UPDATE " + type.name() + " SET body=?, updated_at=? WHERE id=?",
          jsonCodec.toJson(updated), Timestamp.from(updatedAt), id);
      if (rows == 0) {
        throw new EntityNotFoundException(type, id);
      }
      patch.unset().forEach(syncData::putNull);
      syncData.put("updatedAt", updatedAt.toString());
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to update " + type + " entity " + id, e);
    }
    syncQueue.append(syncOperation(SyncOperationType.UPDATE, type, id, jsonCodec.toJson(syncData)));
    return updated;
  }

  @Override
  public <T extends Entity> void delete(EntityType<T> type, String id) {
    Objects.requireNonNull(id, "id");
    try (Connection conn = connectionProvider.getConnection()) {
      JdbcTemplate.update(conn, "DELETE FROM " + type.name() + " WHERE id=?", id);
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to delete " + type + " entity " + id, e);
    }
    syncQueue.append(syncOperation(SyncOperationType.DELETE, type, id, null));
  }

  @Override
  public <T extends Entity> List<T> list(EntityType<T> type, ListOptions options) {
    Objects.requireNonNull(options, "options");
    String sortColumn = SORT_COLUMNS.get(options.sortBy());
    if (options.filters().isEmpty() && sortColumn != null) {
      return listSorted(type, sortColumn, options);
    }
    List<ObjectNode> nodes = scan(type, matchesAll(options.filters()));
    List<ObjectNode> sorted = sort(nodes, options.sortBy(), options.order());
    int from = Math.min(options.offset(), sorted.size());
    int to = options.limit() == null ? sorted.size() : (int) Math.min(sorted.size(), (long) from + options.limit());
    return decodeAll(type, sorted.subList(from, to));
  }

  @Override
  public <T extends Entity> List<T> search(EntityType<T> type, SearchQuery query) {
    Objects.requireNonNull(query, "query");
    Predicate<ObjectNode> predicate = matchesAll(query.filters());
    if (query.hasText()) {
      String needle = query.text().trim().toLowerCase(Locale.ROOT);
      predicate = predicate.and(node -> query.fields().stream()
          .anyMatch(field -> JsonValues.containsText(node.get(field), needle)));
    }
    List<ObjectNode> matches = scan(type, predicate);
    if (query.limit() != null && matches.size() > query.limit()) {
      matches = matches.subList(0, query.limit());
    }
    return decodeAll(type, matches);
  }

  @Override
  public <T extends Entity> List<T> createMany(EntityType<T> type, List<T> items) {
    Objects.requireNonNull(items, "items");
    if (items.isEmpty()) {
      return List.of();
    }
    Instant now = clock.instant();
    List<T> prepared = new ArrayList<>(items.size());
    for (T item : items) {
      prepared.add(prepareNew(type, Objects.requireNonNull(item, "item"), now));
    }
    List<Object[]> rows = new ArrayList<>(prepared.size());
    List<SyncOperation> operations = new ArrayList<>(prepared.size());
    for (T entity : prepared) {
      String body = jsonCodec.toJson(entity);
      rows.add(insertParams(entity, body));
      operations.add(syncOperation(SyncOperationType.CREATE, type, entity.id(), body));
    }
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      JdbcTemplate.batchUpdate(tx.connection(), insertSql(type), rows);
      tx.afterCommit(() -> syncQueue.appendAll(operations));
      tx.commit();
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to create " + items.size() + " " + type + " entities", e);
    }
    return List.copyOf(prepared);
  }

  @Override
  public <T extends Entity> void deleteMany(EntityType<T> type, Collection<String> ids) {
    Objects.requireNonNull(ids, "ids");
    if (ids.isEmpty()) {
      return;
    }
    List<Object[]> rows = new ArrayList<>(ids.size());
    List<SyncOperation> operations = new ArrayList<>(ids.size());
    for (String id : ids) {
      rows.add(new Object[] {Objects.requireNonNull(id, "id")});
      operations.add(syncOperation(SyncOperationType.DELETE, type, id, null));
    }
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      JdbcTemplate.batchUpdate(tx.connection(), "DELETE FROM " + type.name() + " WHERE id=?", rows);
      tx.afterCommit(() -> syncQueue.appendAll(operations));
      tx.commit();
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to delete " + ids.size() + " " + type + " entities", e);
    }
  }

  @Override
  public <T extends Entity> long count(EntityType<T> type) {
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcTemplate.queryLong(conn, "SELECT COUNT(*) FROM " + type.name());
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to count " + type + " entities", e);
    }
  }

  /**
   * Removes every entity, blob and pending sync operation in one transaction. Produces no
   * sync operations.
   */
  @Override
  public void clear() {
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      for (EntityType<?> type : EntityType.values()) {
        JdbcTemplate.update(tx.connection(), "DELETE FROM " + type.name());
      }
      JdbcTemplate.update(tx.connection(), "DELETE FROM " + TableNames.BLOBS);
      JdbcTemplate.update(tx.connection(), "DELETE FROM " + TableNames.SYNC_QUEUE);
      tx.commit();
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to clear the store", e);
    }
  }

  private <T extends Entity> T prepareNew(EntityType<T> type, T item, Instant now) {
    ObjectNode node = jsonCodec.toObject(item);
    if (JsonValues.isAbsent(node.get("id"))) {
      node.put("id", Ids.newEntityId());
    }
    Instant createdAt = instantField(node, "createdAt");
    if (createdAt == null) {
      createdAt = now;
      node.put("createdAt", createdAt.toString());
    }
    Instant updatedAt = instantField(node, "updatedAt");
    if (updatedAt == null || updatedAt.isBefore(createdAt)) {
      node.put("updatedAt", (now.isBefore(createdAt) ? createdAt : now).toString());
    }
    return validator.validate(jsonCodec.fromTree(node, type.javaType()));
  }

  private static String insertSql(EntityType<?> type) {
    return "INSERT INTO " + type.name() + " (id, body, created_at, updated_at) VALUES (?,?,?,?)";
  }

  private static Object[] insertParams(Entity entity, String body) {
    return new Object[] {
        entity.id(), body, Timestamp.from(entity.createdAt()), Timestamp.from(entity.updatedAt())
    };
  }

  private <T extends Entity> List<T> listSorted(EntityType<T> type, String sortColumn, ListOptions options) {
    String direction = options.order() == SortOrder.ASC ? "ASC" : "DESC";
    List<Object> params = new ArrayList<>();
    String sql = "SELECT id, body FROM " + type.name() +
        " ORDER BY " + sortColumn + " " + direction + ", id " + direction +
        pagingClause(options.offset(), options.limit(), params);
    try (Connection conn = connectionProvider.getConnection()) {
      List<StoredRow> rows = JdbcTemplate.query(conn, sql, ROW_MAPPER, params.toArray());
      List<T> result = new ArrayList<>(rows.size());
      for (StoredRow row : rows) {
        result.add(decode(type, row));
      }
      return result;
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to list " + type + " entities", e);
    }
  }

  private List<ObjectNode> scan(EntityType<?> type, Predicate<ObjectNode> predicate) {
    List<StoredRow> rows;
    try (Connection conn = connectionProvider.getConnection()) {
      rows = JdbcTemplate.query(conn, "SELECT id, body FROM " + type.name() + " ORDER BY id", ROW_MAPPER);
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to scan " + type + " entities", e);
    }
    List<ObjectNode> matches = new ArrayList<>();
    for (StoredRow row : rows) {
      ObjectNode node = parseObject(type, row);
      if (predicate.test(node)) {
        matches.add(node);
      }
    }
    return matches;
  }

  private Predicate<ObjectNode> matchesAll(Map<String, Object> filters) {
    if (filters.isEmpty()) {
      return node -> true;
    }
    Map<String, JsonNode> expected = new LinkedHashMap<>();
    filters.forEach((field, value) -> expected.put(field, jsonCodec.toTree(value)));
    return node -> expected.entrySet().stream()
        .allMatch(e -> JsonValues.matches(node.get(e.getKey()), e.getValue()));
  }

  private static List<ObjectNode> sort(List<ObjectNode> nodes, String field, SortOrder order) {
    List<ObjectNode> present = new ArrayList<>();
    List<ObjectNode> missing = new ArrayList<>();
    for (ObjectNode node : nodes) {
      (JsonValues.isAbsent(node.get(field)) ? missing : present).add(node);
    }
    Comparator<ObjectNode> comparator = Comparator
        .comparing((ObjectNode node) -> node.get(field), JsonValues.NATURAL_ORDER)
        .thenComparing(node -> node.path("id").asText());
    present.sort(order == SortOrder.ASC ? comparator : comparator.reversed());
    present.addAll(missing);
    return present;
  }

  private Optional<StoredRow> selectRow(Connection conn, EntityType<?> type, String id) {
    return JdbcTemplate.queryOne(conn, "SELECT id, body FROM " + type.name() + " WHERE id=?", ROW_MAPPER, id);
  }

  private <T extends Entity> List<T> decodeAll(EntityType<T> type, List<ObjectNode> nodes) {
    List<T> result = new ArrayList<>(nodes.size());
    for (ObjectNode node : nodes) {
      result.add(decode(type, node.path("id").asText(), node));
    }
    return result;
  }

  private <T extends Entity> T decode(EntityType<T> type, StoredRow row) {
    return decode(type, row.id(), parseObject(type, row));
  }

  private <T extends Entity> T decode(EntityType<T> type, String id, ObjectNode node) {
    try {
      return jsonCodec.fromTree(node, type.javaType());
    } catch (ValidationException e) {
      throw new StorageUnavailableException("Stored " + type + " entity " + id + " is unreadable", e);
    }
  }

  private ObjectNode parseObject(EntityType<?> type, StoredRow row) {
    JsonNode node;
    try {
      node = jsonCodec.parse(row.body());
    } catch (ValidationException e) {
      throw new StorageUnavailableException("Stored " + type + " entity " + row.id() + " is unreadable", e);
    }
    if (!(node instanceof ObjectNode object)) {
      throw new StorageUnavailableException("Stored " + type + " entity " + row.id() + " is not a JSON object");
    }
    return object;
  }

  private static Instant instantField(ObjectNode node, String field) {
    JsonNode value = node.get(field);
    if (JsonValues.isAbsent(value)) {
      return null;
    }
    try {
      return Instant.parse(value.asText());
    } catch (DateTimeParseException e) {
      throw new ValidationException(field, "must be an ISO-8601 instant");
    }
  }

  private SyncOperation syncOperation(SyncOperationType opType, EntityType<?> type, String id, String dataJson) {
    return new SyncOperation(Ids.newSyncOperationId(), opType, type.name(), id, dataJson, nextSyncTimestamp());
  }

  /**
   * Timestamps handed to the sync queue strictly increase at the column precision
   * (microseconds), so replay order matches mutation order within this store.
   */
  private synchronized Instant nextSyncTimestamp() {
    Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
    lastSyncTimestamp = now.isAfter(lastSyncTimestamp) ? now : lastSyncTimestamp.plus(1, ChronoUnit.MICROS);
    return lastSyncTimestamp;
  }

  private record StoredRow(String id, String body) {
  }
}
