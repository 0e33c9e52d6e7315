package notestore.migration;

import notestore.EntityType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered registry of schema migrations per collection.
 *
 * <p>Versions start at 1. For each collection the registered steps must form a
 * contiguous chain {@code 1 -> 2 -> ... -> latest}; gaps and duplicates are rejected at
 * build time.
 */
public final class SchemaMigrations {
  public static final int BASELINE_VERSION = 1;

  private final Map<EntityType<?>, List<SchemaMigration>> steps;

  private SchemaMigrations(Map<EntityType<?>, List<SchemaMigration>> steps) {
    this.steps = steps;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Registry with no migrations: every collection stays at the baseline version.
   */
  public static SchemaMigrations none() {
    return builder().build();
  }

  /**
   * The schema history shipped with the store.
   */
  public static SchemaMigrations defaults() {
    return builder()
        .add(new NoteCaptureMethodMigration())
        .add(new RehearsalSessionDefaultsMigration())
        .add(new PerformanceStatusMigration())
        .build();
  }

  /**
   * Version a collection is at once every registered step has run.
   */
  public int latestVersion(EntityType<?> collection) {
    List<SchemaMigration> chain = steps.getOrDefault(collection, List.of());
    return chain.isEmpty() ? BASELINE_VERSION : chain.get(chain.size() - 1).toVersion();
  }

  /**
   * Steps still to run for a collection currently at {@code currentVersion}, in order.
   */
  public List<SchemaMigration> pending(EntityType<?> collection, int currentVersion) {
    List<SchemaMigration> result = new ArrayList<>();
    for (SchemaMigration step : steps.getOrDefault(collection, List.of())) {
      if (step.fromVersion() >= currentVersion) {
        result.add(step);
      }
    }
    return result;
  }

  public static final class Builder {
    private final List<SchemaMigration> migrations = new ArrayList<>();

    private Builder() {}

    public Builder add(SchemaMigration migration) {
      migrations.add(Objects.requireNonNull(migration, "migration"));
      return this;
    }

    public SchemaMigrations build() {
      Map<EntityType<?>, List<SchemaMigration>> byCollection = new LinkedHashMap<>();
      for (SchemaMigration migration : migrations) {
        byCollection.computeIfAbsent(migration.collection(), c -> new ArrayList<>()).add(migration);
      }
      Map<EntityType<?>, List<SchemaMigration>> result = new LinkedHashMap<>();
      for (Map.Entry<EntityType<?>, List<SchemaMigration>> entry : byCollection.entrySet()) {
        List<SchemaMigration> chain = new ArrayList<>(entry.getValue());
        chain.sort(Comparator.comparingInt(SchemaMigration::fromVersion));
        int expected = BASELINE_VERSION;
        for (SchemaMigration step : chain) {
          if (step.toVersion() != step.fromVersion() + 1) {
            throw new IllegalArgumentException("Migration " + step.description()
                + " must advance exactly one version");
          }
          if (step.fromVersion() != expected) {
            throw new IllegalArgumentException("Migrations for " + entry.getKey()
                + " are not contiguous: expected a step from version " + expected
                + " but found one from " + step.fromVersion());
          }
          expected++;
        }
        result.put(entry.getKey(), Collections.unmodifiableList(chain));
      }
      return new SchemaMigrations(Collections.unmodifiableMap(result));
    }
  }
}
