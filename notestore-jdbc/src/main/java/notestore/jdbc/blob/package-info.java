/**
 * Blob store implementations.
 */
package notestore.jdbc.blob;
