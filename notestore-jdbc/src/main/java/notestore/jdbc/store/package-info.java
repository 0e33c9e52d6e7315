/**
 * Entity store implementations. Entities are stored as JSON documents, one table per collection.
 */
package notestore.jdbc.store;
