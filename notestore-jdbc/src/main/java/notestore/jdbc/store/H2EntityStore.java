package notestore.jdbc.store;

import notestore.spi.ConnectionProvider;
import notestore.spi.SyncQueue;
import notestore.util.JsonCodec;
import notestore.validation.EntityValidator;

import java.time.Clock;
import java.util.List;

/**
 * H2 entity store. Uses the default SQL:2008 paging from {@link AbstractJdbcEntityStore}.
 */
public final class H2EntityStore extends AbstractJdbcEntityStore {
  public static final List<String> JDBC_URL_PREFIXES = List.of("jdbc:h2:");

  public H2EntityStore(ConnectionProvider connectionProvider, SyncQueue syncQueue) {
    this(connectionProvider, syncQueue, JsonCodec.getDefault(), EntityValidator.getDefault(), Clock.systemUTC());
  }

  public H2EntityStore(
      ConnectionProvider connectionProvider,
      SyncQueue syncQueue,
      JsonCodec jsonCodec,
      EntityValidator validator,
      Clock clock
  ) {
    super(connectionProvider, syncQueue, jsonCodec, validator, clock);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return JDBC_URL_PREFIXES;
  }
}
