/**
 * Storage-level model objects shared by the SPI and its implementations.
 *
 * <p>Contains the sync queue entry, its operation type, and the stored blob representation.
 *
 * @see notestore.model.SyncOperation
 * @see notestore.model.BlobRecord
 */
package notestore.model;
