/**
 * Domain service layer over the entity store.
 *
 * <p>Services enforce the invariants that span rows or components: cascading blob
 * deletion for notes, the derived set list duration, nested read-modify-write on contacts
 * and venues, performance statistics and concurrent global search. Expected failures come
 * back as {@link notestore.service.Result}; storage failures propagate as exceptions.
 */
package notestore.service;
