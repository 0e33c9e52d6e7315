/**
 * Per-collection schema versioning.
 *
 * <p>A {@link notestore.migration.SchemaMigration} rewrites stored rows of one collection
 * from version N to N+1. {@link notestore.migration.SchemaMigrations} holds the chain for
 * every collection; the storage backend runs pending steps while opening, before any
 * read or write is served, and refuses to open if one fails.
 */
package notestore.migration;
