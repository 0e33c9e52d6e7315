/**
 * Table-backed sync queue.
 */
package notestore.jdbc.sync;
