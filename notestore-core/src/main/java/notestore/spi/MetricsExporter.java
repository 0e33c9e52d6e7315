package notestore.spi;

/**
 * Observability hook for exporting store counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of sync operations appended to the queue.
   */
  void incrementSyncAppended(int count);

  /**
   * Increments the count of sync operations that could not be appended and were dropped.
   */
  void incrementSyncAppendFailed(int count);

  /**
   * Increments the count of sync operations acknowledged by the sync collaborator.
   */
  void incrementSyncAcknowledged(int count);

  /**
   * Records the number of entries currently waiting in the sync queue.
   */
  void recordSyncQueueDepth(int depth);

  /**
   * Records a stored blob and its size.
   */
  default void recordBlobStored(long sizeBytes) {
  }

  default void incrementBlobDeleted() {
  }

  /**
   * Increments the count of schema migration steps applied.
   */
  default void incrementMigrationSteps() {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementSyncAppended(int count) {
    }

    @Override
    public void incrementSyncAppendFailed(int count) {
    }

    @Override
    public void incrementSyncAcknowledged(int count) {
    }

    @Override
    public void recordSyncQueueDepth(int depth) {
    }
  }
}
