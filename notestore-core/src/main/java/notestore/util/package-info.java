/**
 * Shared helpers: JSON codec, JSON value comparison, id generation and thread factory.
 */
package notestore.util;
