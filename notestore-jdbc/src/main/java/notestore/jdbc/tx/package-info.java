/**
 * Manual JDBC transaction handling with after-commit callbacks.
 */
package notestore.jdbc.tx;
