/**
 * Domain records stored by the entity store, one per collection, plus their nested values.
 *
 * <p>Records carry Jakarta Bean Validation constraints checked by
 * {@link notestore.validation.EntityValidator} on every write. Optional fields are
 * nullable and omitted from the stored JSON; list fields are never {@code null}.
 */
package notestore.domain;
