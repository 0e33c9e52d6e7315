package notestore.jdbc.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import notestore.EntityType;
import notestore.SchemaMigrationException;
import notestore.jdbc.DataSourceConnectionProvider;
import notestore.jdbc.JdbcTemplate;
import notestore.jdbc.MutableClock;
import notestore.jdbc.RecordingMetricsExporter;
import notestore.jdbc.TestDataSources;
import notestore.migration.SchemaMigration;
import notestore.migration.SchemaMigrations;
import notestore.spi.ConnectionProvider;
import notestore.util.JsonCodec;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SchemaMigratorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final JsonCodec codec = JsonCodec.getDefault();
    private JdbcDataSource dataSource;
    private ConnectionProvider connectionProvider;
    private RecordingMetricsExporter metrics;

    @BeforeEach
    void setUp() {
        dataSource = TestDataSources.h2WithSchema();
        connectionProvider = new DataSourceConnectionProvider(dataSource);
        metrics = new RecordingMetricsExporter();
    }

    @Test
    void freshDatabaseStartsAtBaseline() {
        SchemaMigrator migrator = migrator(SchemaMigrations.none());

        for (EntityType<?> type : EntityType.values()) {
            assertEquals(SchemaMigrations.BASELINE_VERSION, migrator.currentVersion(type));
        }
        assertEquals(0, migrator.migrate());
    }

    @Test
    void legacyRowsAreMigratedAndVersionsRecorded() throws Exception {
        insertRow("notes", "n1", "{\"id\":\"n1\",\"content\":\"bit\",\"type\":\"mixed\"}");
        insertRow("notes", "n2", "{\"id\":\"n2\",\"content\":\"memo\",\"type\":\"voice\"}");
        insertRow("performances", "p1", "{\"id\":\"p1\",\"setListId\":\"s\",\"venueId\":\"v\"}");
        insertRow("rehearsal_sessions", "r1", "{\"id\":\"r1\",\"setListId\":\"s\"}");
        SchemaMigrator migrator = migrator(SchemaMigrations.defaults());

        assertEquals(3, migrator.migrate());

        JsonNode n1 = body("notes", "n1");
        assertEquals("text", n1.get("captureMethod").asText());
        assertFalse(n1.has("type"));
        assertEquals("voice", body("notes", "n2").get("captureMethod").asText());
        assertEquals("scheduled", body("performances", "p1").get("status").asText());
        JsonNode r1 = body("rehearsal_sessions", "r1");
        assertEquals(0, r1.get("currentNoteIndex").asInt());
        assertFalse(r1.get("isCompleted").asBoolean());
        assertEquals(2, migrator.currentVersion(EntityType.NOTES));
        assertEquals(1, migrator.currentVersion(EntityType.CONTACTS));
        assertEquals(3, metrics.migrationSteps.get());
    }

    @Test
    void migrateIsIdempotent() {
        SchemaMigrator migrator = migrator(SchemaMigrations.defaults());

        assertEquals(3, migrator.migrate());
        assertEquals(0, migrator.migrate());
    }

    @Test
    void failingStepLeavesRowsAndVersionUntouched() throws Exception {
        insertRow("contacts", "c1", "{\"id\":\"c1\",\"name\":\"A\"}");
        insertRow("contacts", "c2", "{\"id\":\"c2\",\"name\":\"B\"}");
        SchemaMigrator migrator = migrator(SchemaMigrations.builder().add(new FailingOnSecondRow()).build());

        SchemaMigrationException ex = assertThrows(SchemaMigrationException.class, migrator::migrate);

        assertEquals("Schema migration failed: contacts: fails on c2", ex.getMessage());
        assertFalse(body("contacts", "c1").has("migrated"));
        assertEquals(1, migrator.currentVersion(EntityType.CONTACTS));
        assertEquals(0, metrics.migrationSteps.get());
    }

    @Test
    void databaseAheadOfKnownMigrationsIsRefused() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            JdbcSchemaVersions.write(conn, EntityType.NOTES, 7, T0);
        }

        assertThrows(SchemaMigrationException.class, () -> migrator(SchemaMigrations.defaults()).migrate());
    }

    private SchemaMigrator migrator(SchemaMigrations migrations) {
        return new SchemaMigrator(connectionProvider, migrations, codec, metrics, new MutableClock(T0));
    }

    private void insertRow(String table, String id, String body) throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            JdbcTemplate.update(conn, "INSERT INTO " + table + " (id, body, created_at, updated_at) VALUES (?,?,?,?)",
                    id, body, Timestamp.from(T0), Timestamp.from(T0));
        }
    }

    private JsonNode body(String table, String id) throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            return codec.parse(JdbcTemplate.queryOne(conn, "SELECT body FROM " + table + " WHERE id=?",
                    rs -> rs.getString(1), id).orElseThrow());
        }
    }

    private static final class FailingOnSecondRow implements SchemaMigration {

        @Override
        public EntityType<?> collection() {
            return EntityType.CONTACTS;
        }

        @Override
        public int fromVersion() {
            return 1;
        }

        @Override
        public String description() {
            return "contacts: fails on c2";
        }

        @Override
        public ObjectNode migrate(ObjectNode row) {
            if ("c2".equals(row.path("id").asText())) {
                throw new IllegalStateException("cannot migrate c2");
            }
            return row.put("migrated", true);
        }
    }
}
