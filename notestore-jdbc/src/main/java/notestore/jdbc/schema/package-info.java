/**
 * Table creation, per-collection schema versions and the migrator that applies
 * {@link notestore.migration.SchemaMigration} steps on open.
 */
package notestore.jdbc.schema;
