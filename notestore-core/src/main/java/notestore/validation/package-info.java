/**
 * Constraint checking of domain records before they are persisted.
 */
package notestore.validation;
