/**
 * Service Provider Interfaces (SPI) of the store.
 *
 * <p>These interfaces define the seams between the domain services and the storage
 * backend: entity persistence, blob persistence, the sync outbox, connection
 * provisioning and metrics.
 *
 * @see notestore.spi.EntityStore
 * @see notestore.spi.BlobStore
 * @see notestore.spi.SyncQueue
 * @see notestore.spi.ConnectionProvider
 * @see notestore.spi.MetricsExporter
 */
package notestore.spi;
