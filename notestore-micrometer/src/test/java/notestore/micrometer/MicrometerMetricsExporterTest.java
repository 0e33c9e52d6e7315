package notestore.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void incrementSyncAppended() {
    exporter.incrementSyncAppended(3);
    exporter.incrementSyncAppended(1);
    assertEquals(4.0, counter("notestore.sync.appended").count());
  }

  @Test
  void incrementSyncAppendFailed() {
    exporter.incrementSyncAppendFailed(2);
    assertEquals(2.0, counter("notestore.sync.append.failed").count());
  }

  @Test
  void incrementSyncAcknowledged() {
    exporter.incrementSyncAcknowledged(1);
    assertEquals(1.0, counter("notestore.sync.acknowledged").count());
  }

  @Test
  void recordSyncQueueDepth() {
    exporter.recordSyncQueueDepth(42);
    assertEquals(42.0, gauge("notestore.sync.depth").value());

    exporter.recordSyncQueueDepth(0);
    assertEquals(0.0, gauge("notestore.sync.depth").value());
  }

  @Test
  void recordBlobStored() {
    exporter.recordBlobStored(1024);
    exporter.recordBlobStored(2048);

    DistributionSummary summary = registry.find("notestore.blob.stored").summary();
    assertNotNull(summary);
    assertEquals(2, summary.count());
    assertEquals(3072.0, summary.totalAmount());
  }

  @Test
  void blobDeletedAndMigrationSteps() {
    exporter.incrementBlobDeleted();
    exporter.incrementMigrationSteps();
    exporter.incrementMigrationSteps();

    assertEquals(1.0, counter("notestore.blob.deleted").count());
    assertEquals(2.0, counter("notestore.migration.steps").count());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "capture.notestore");
    custom.incrementSyncAppended(1);
    custom.recordSyncQueueDepth(5);

    assertEquals(1.0, counter("capture.notestore.sync.appended").count());
    assertEquals(5.0, gauge("capture.notestore.sync.depth").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementSyncAppended(1);
    exporter.close();

    assertNull(registry.find("notestore.sync.appended").counter());
    assertNull(registry.find("notestore.sync.depth").gauge());
    assertDoesNotThrow(() -> exporter.incrementSyncAppended(1));
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "notes."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
