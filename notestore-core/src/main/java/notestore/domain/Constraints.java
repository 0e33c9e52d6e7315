package notestore.domain;

import java.util.List;

/**
 * Shared constraint values of the domain records.
 */
public final class Constraints {
  public static final String UUID =
      "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";
  public static final String PHONE = "^[+]?[0-9\\s\\-()]{7,20}$";
  public static final String SOCIAL_PLATFORM = "^[a-zA-Z0-9_]+$";

  private Constraints() {}

  /**
   * Immutable copy of a record list component; {@code null} becomes an empty list.
   */
  static <T> List<T> list(List<T> values) {
    return values == null ? List.of() : List.copyOf(values);
  }
}
