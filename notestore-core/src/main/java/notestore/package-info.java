/**
 * Core API of the offline-first entity store.
 *
 * <p>Key types:
 * <ul>
 *   <li>{@link notestore.EntityType} - typed collection identifiers</li>
 *   <li>{@link notestore.Entity} - the bookkeeping contract every stored record meets</li>
 *   <li>{@link notestore.ListOptions}, {@link notestore.SearchQuery}, {@link notestore.Patch} -
 *       arguments of the {@link notestore.spi.EntityStore} operations</li>
 *   <li>{@link notestore.StoreException} and its subclasses - the error taxonomy</li>
 * </ul>
 *
 * <p>Every mutation is persisted first and then recorded in the
 * {@link notestore.spi.SyncQueue} for eventual delivery to the remote backend.
 *
 * @see notestore.spi
 * @see notestore.service
 */
package notestore;
