package notestore;

/**
 * Direction of a single-field sort.
 */
public enum SortOrder {
  ASC,
  DESC
}
