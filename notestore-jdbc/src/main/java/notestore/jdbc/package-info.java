/**
 * JDBC implementation of the store over H2.
 *
 * <p>{@link notestore.jdbc.NoteStore} opens everything at once: it installs the tables,
 * runs schema migrations and wires the entity store, blob store and sync queue.
 * {@link notestore.jdbc.JdbcTemplate} holds the shared statement helpers.
 */
package notestore.jdbc;
