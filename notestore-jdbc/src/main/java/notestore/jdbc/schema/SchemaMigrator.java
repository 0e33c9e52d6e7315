package notestore.jdbc.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import notestore.EntityType;
import notestore.SchemaMigrationException;
import notestore.jdbc.JdbcTemplate;
import notestore.jdbc.tx.JdbcTransactionManager;
import notestore.migration.SchemaMigration;
import notestore.migration.SchemaMigrations;
import notestore.spi.ConnectionProvider;
import notestore.spi.MetricsExporter;
import notestore.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Brings every collection up to the latest version known to a {@link SchemaMigrations}
 * registry.
 *
 * <p>Each step rewrites all rows of one collection and records the new version in the same
 * transaction, so a failed step leaves the collection exactly as it was. A collection
 * recorded at a version newer than the registry knows is refused.
 */
public final class SchemaMigrator {
  private static final Logger logger = Logger.getLogger(SchemaMigrator.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JdbcTransactionManager txManager;
  private final SchemaMigrations migrations;
  private final JsonCodec jsonCodec;
  private final MetricsExporter metrics;
  private final Clock clock;

  public SchemaMigrator(
      ConnectionProvider connectionProvider,
      SchemaMigrations migrations,
      JsonCodec jsonCodec,
      MetricsExporter metrics,
      Clock clock
  ) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txManager = new JdbcTransactionManager(connectionProvider);
    this.migrations = Objects.requireNonNull(migrations, "migrations");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs all pending steps for every collection.
   *
   * @return number of steps applied
   * @throws SchemaMigrationException if a step fails or a collection is ahead of the registry
   */
  public int migrate() {
    int applied = 0;
    for (EntityType<?> collection : EntityType.values()) {
      int current = currentVersion(collection);
      int latest = migrations.latestVersion(collection);
      if (current > latest) {
        throw new SchemaMigrationException("Collection " + collection + " is at schema version " + current
            + " but only versions up to " + latest + " are known");
      }
      for (SchemaMigration step : migrations.pending(collection, current)) {
        applyStep(step);
        applied++;
      }
    }
    return applied;
  }

  public int currentVersion(EntityType<?> collection) {
    try (Connection conn = connectionProvider.getConnection()) {
      return JdbcSchemaVersions.read(conn, collection);
    } catch (SQLException | RuntimeException e) {
      throw new SchemaMigrationException("Failed to read schema version of " + collection, e);
    }
  }

  private void applyStep(SchemaMigration step) {
    EntityType<?> collection = step.collection();
    int rowCount;
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      Connection conn = tx.connection();
      List<String[]> rows = JdbcTemplate.query(conn,
          "SELECT id, body FROM " + collection.name() + " ORDER BY id",
          rs -> new String[] {rs.getString("id"), rs.getString("body")});
      List<Object[]> updates = new ArrayList<>(rows.size());
      for (String[] row : rows) {
        updates.add(new Object[] {jsonCodec.toJson(migrateRow(step, row[0], row[1])), row[0]});
      }
      JdbcTemplate.batchUpdate(conn, "UPDATE " + collection.name() + " SET body=? WHERE id=?", updates);
      JdbcSchemaVersions.write(conn, collection, step.toVersion(), clock.instant());
      tx.commit();
      rowCount = rows.size();
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Schema migration failed: " + step.description(), e);
      throw new SchemaMigrationException("Schema migration failed: " + step.description(), e);
    }
    metrics.incrementMigrationSteps();
    logger.log(Level.INFO, "Migrated {0} from version {1} to {2} ({3} rows): {4}",
        new Object[] {collection, step.fromVersion(), step.toVersion(), rowCount, step.description()});
  }

  private ObjectNode migrateRow(SchemaMigration step, String id, String body) {
    JsonNode node = jsonCodec.parse(body);
    if (!(node instanceof ObjectNode object)) {
      throw new SchemaMigrationException("Row " + id + " of " + step.collection() + " is not a JSON object");
    }
    ObjectNode migrated = step.migrate(object);
    if (migrated == null) {
      throw new SchemaMigrationException("Migration returned no row for " + id + ": " + step.description());
    }
    return migrated;
  }
}
