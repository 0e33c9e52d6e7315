package notestore.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import notestore.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code notestore.sync.appended} - sync operations appended to the queue</li>
 *   <li>{@code notestore.sync.append.failed} - sync operations lost because the append failed</li>
 *   <li>{@code notestore.sync.acknowledged} - sync operations removed after delivery</li>
 *   <li>{@code notestore.blob.deleted} - blobs deleted</li>
 *   <li>{@code notestore.migration.steps} - schema migration steps applied</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code notestore.blob.stored} - bytes per stored blob</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code notestore.sync.depth} - last observed sync queue depth</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter syncAppended;
  private final Counter syncAppendFailed;
  private final Counter syncAcknowledged;
  private final DistributionSummary blobStored;
  private final Counter blobDeleted;
  private final Counter migrationSteps;
  private final Gauge syncDepthGauge;

  private final AtomicInteger syncDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "notestore"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "notestore");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "capture.notestore"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.syncAppended = Counter.builder(namePrefix + ".sync.appended")
        .description("Sync operations appended to the queue")
        .register(registry);
    this.syncAppendFailed = Counter.builder(namePrefix + ".sync.append.failed")
        .description("Sync operations lost because the append failed")
        .register(registry);
    this.syncAcknowledged = Counter.builder(namePrefix + ".sync.acknowledged")
        .description("Sync operations removed after delivery")
        .register(registry);
    this.blobStored = DistributionSummary.builder(namePrefix + ".blob.stored")
        .description("Bytes per stored blob")
        .baseUnit("bytes")
        .register(registry);
    this.blobDeleted = Counter.builder(namePrefix + ".blob.deleted")
        .description("Blobs deleted")
        .register(registry);
    this.migrationSteps = Counter.builder(namePrefix + ".migration.steps")
        .description("Schema migration steps applied")
        .register(registry);

    this.syncDepthGauge = Gauge.builder(namePrefix + ".sync.depth", syncDepth, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementSyncAppended(int count) {
    if (closed) return;
    syncAppended.increment(count);
  }

  @Override
  public void incrementSyncAppendFailed(int count) {
    if (closed) return;
    syncAppendFailed.increment(count);
  }

  @Override
  public void incrementSyncAcknowledged(int count) {
    if (closed) return;
    syncAcknowledged.increment(count);
  }

  @Override
  public void recordSyncQueueDepth(int depth) {
    if (closed) return;
    syncDepth.set(depth);
  }

  @Override
  public void recordBlobStored(long sizeBytes) {
    if (closed) return;
    blobStored.record(sizeBytes);
  }

  @Override
  public void incrementBlobDeleted() {
    if (closed) return;
    blobDeleted.increment();
  }

  @Override
  public void incrementMigrationSteps() {
    if (closed) return;
    migrationSteps.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>{@link notestore.spi.MetricsExporter} owners such as the JDBC store handle call this on
   * close to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(syncAppended, syncAppendFailed, syncAcknowledged,
        blobStored, blobDeleted, migrationSteps, syncDepthGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
