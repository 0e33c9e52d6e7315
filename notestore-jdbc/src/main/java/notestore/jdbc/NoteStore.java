package notestore.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import notestore.StorageUnavailableException;
import notestore.jdbc.blob.H2BlobStore;
import notestore.jdbc.schema.SchemaInstaller;
import notestore.jdbc.schema.SchemaMigrator;
import notestore.jdbc.store.H2EntityStore;
import notestore.jdbc.sync.JdbcSyncQueue;
import notestore.media.MediaOptions;
import notestore.migration.SchemaMigrations;
import notestore.service.StorageService;
import notestore.spi.BlobStore;
import notestore.spi.ConnectionProvider;
import notestore.spi.EntityStore;
import notestore.spi.MetricsExporter;
import notestore.spi.SyncQueue;
import notestore.util.JsonCodec;
import notestore.validation.EntityValidator;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handle to an opened store: entity store, blob store and sync queue over one H2 database,
 * plus the domain services built on them.
 *
 * <p>Open once, pass the handle to whoever needs it, close once:
 * <pre>{@code
 * try (NoteStore store = NoteStore.builder()
 *     .jdbcUrl("jdbc:h2:file:./data/notestore")
 *     .build()) {
 *   store.services().notes().create(note);
 * }
 * }</pre>
 *
 * <p>Opening installs missing tables and runs pending schema migrations before any component
 * is handed out. If either fails, the pool is closed and nothing is exposed.
 */
public final class NoteStore implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(NoteStore.class.getName());

  private final HikariDataSource ownedPool;
  private final H2EntityStore entities;
  private final H2BlobStore blobs;
  private final JdbcSyncQueue syncQueue;
  private final StorageService services;
  private final MetricsExporter metrics;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private NoteStore(HikariDataSource ownedPool, H2EntityStore entities, H2BlobStore blobs,
      JdbcSyncQueue syncQueue, StorageService services, MetricsExporter metrics) {
    this.ownedPool = ownedPool;
    this.entities = entities;
    this.blobs = blobs;
    this.syncQueue = syncQueue;
    this.services = services;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  public EntityStore entities() {
    return entities;
  }

  public BlobStore blobs() {
    return blobs;
  }

  public SyncQueue syncQueue() {
    return syncQueue;
  }

  /**
   * Domain services sharing this store's components.
   */
  public StorageService services() {
    return services;
  }

  /**
   * Shuts down the search executor, the connection pool (when owned) and the metrics
   * exporter (when closeable), in that order. Subsequent calls are no-ops.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    try {
      services.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (ownedPool != null) {
      try {
        ownedPool.close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    logger.log(Level.INFO, "Closed {0} store", entities.name());
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link NoteStore}. Exactly one of {@link #jdbcUrl} and {@link #dataSource}
   * must be set; a data source passed in stays owned by the caller.
   */
  public static final class Builder {
    private String jdbcUrl;
    private String username;
    private String password;
    private int maxPoolSize = 4;
    private DataSource dataSource;
    private SchemaMigrations migrations;
    private MetricsExporter metrics;
    private Clock clock;
    private JsonCodec jsonCodec;
    private EntityValidator validator;
    private MediaOptions mediaOptions;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    public Builder jdbcUrl(String jdbcUrl) {
      this.jdbcUrl = jdbcUrl;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    /**
     * Maximum pool size when the store creates its own pool. Default 4.
     */
    public Builder maxPoolSize(int maxPoolSize) {
      this.maxPoolSize = maxPoolSize;
      return this;
    }

    public Builder dataSource(DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    /**
     * Schema history to apply on open. Default {@link SchemaMigrations#defaults()}.
     */
    public Builder migrations(SchemaMigrations migrations) {
      this.migrations = migrations;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public Builder validator(EntityValidator validator) {
      this.validator = validator;
      return this;
    }

    public Builder mediaOptions(MediaOptions mediaOptions) {
      this.mediaOptions = mediaOptions;
      return this;
    }

    /**
     * Opens the store.
     *
     * @throws IllegalArgumentException if the configuration is incomplete or contradictory
     * @throws StorageUnavailableException if the database cannot be reached
     * @throws notestore.SchemaMigrationException if a schema migration fails
     */
    public NoteStore build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      if ((jdbcUrl == null) == (dataSource == null)) {
        throw new IllegalArgumentException("Exactly one of jdbcUrl and dataSource must be set");
      }
      if (jdbcUrl != null && H2EntityStore.JDBC_URL_PREFIXES.stream().noneMatch(jdbcUrl::startsWith)) {
        throw new IllegalArgumentException("Unsupported JDBC URL: " + jdbcUrl);
      }
      if (maxPoolSize < 1) {
        throw new IllegalArgumentException("maxPoolSize must be >= 1, got " + maxPoolSize);
      }
      MetricsExporter metricsExporter = metrics == null ? MetricsExporter.NOOP : metrics;
      Clock storeClock = clock == null ? Clock.systemUTC() : clock;
      JsonCodec codec = jsonCodec == null ? JsonCodec.getDefault() : jsonCodec;
      EntityValidator entityValidator = validator == null ? EntityValidator.getDefault() : validator;
      SchemaMigrations schemaMigrations = migrations == null ? SchemaMigrations.defaults() : migrations;
      MediaOptions media = mediaOptions == null ? MediaOptions.defaults() : mediaOptions;

      HikariDataSource pool = dataSource == null ? openPool() : null;
      ConnectionProvider connectionProvider = new DataSourceConnectionProvider(pool != null ? pool : dataSource);
      try {
        try (Connection conn = connectionProvider.getConnection()) {
          SchemaInstaller.install(conn);
        }
        new SchemaMigrator(connectionProvider, schemaMigrations, codec, metricsExporter, storeClock).migrate();

        JdbcSyncQueue syncQueue = new JdbcSyncQueue(connectionProvider, metricsExporter);
        H2EntityStore entities = new H2EntityStore(connectionProvider, syncQueue, codec, entityValidator, storeClock);
        H2BlobStore blobs = new H2BlobStore(connectionProvider, metricsExporter, storeClock);
        StorageService services = new StorageService(entities, blobs, syncQueue, storeClock, codec, media);
        logger.log(Level.INFO, "Opened {0} store", entities.name());
        return new NoteStore(pool, entities, blobs, syncQueue, services, metricsExporter);
      } catch (SQLException e) {
        closeOnFailure(pool, e);
        throw new StorageUnavailableException("Failed to open store", e);
      } catch (RuntimeException e) {
        closeOnFailure(pool, e);
        throw e;
      }
    }

    private HikariDataSource openPool() {
      HikariConfig config = new HikariConfig();
      config.setJdbcUrl(jdbcUrl);
      if (username != null) {
        config.setUsername(username);
      }
      if (password != null) {
        config.setPassword(password);
      }
      config.setMaximumPoolSize(maxPoolSize);
      config.setPoolName("notestore");
      try {
        return new HikariDataSource(config);
      } catch (RuntimeException e) {
        throw new StorageUnavailableException("Failed to open connection pool for " + jdbcUrl, e);
      }
    }

    private static void closeOnFailure(HikariDataSource pool, Exception cause) {
      if (pool == null) {
        return;
      }
      try {
        pool.close();
      } catch (RuntimeException e) {
        cause.addSuppressed(e);
      }
    }
  }
}
