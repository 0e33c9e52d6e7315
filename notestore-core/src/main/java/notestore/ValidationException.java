package notestore;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a value does not satisfy the constraints of its collection.
 *
 * <p>Carries every violation found, not just the first one.
 */
public class ValidationException extends StoreException {

  /**
   * A single failed constraint.
   *
   * @param path    property path of the offending value, e.g. {@code tags[2]}
   * @param message human readable reason
   */
  public record Violation(String path, String message) {
    @Override
    public String toString() {
      return path.isEmpty() ? message : path + ": " + message;
    }
  }

  private final List<Violation> violations;

  public ValidationException(List<Violation> violations) {
    super(describe(violations));
    this.violations = List.copyOf(violations);
  }

  public ValidationException(String path, String message) {
    this(List.of(new Violation(path, message)));
  }

  protected ValidationException(String message, Throwable cause) {
    super(message, cause);
    this.violations = List.of(new Violation("", message));
  }

  public List<Violation> violations() {
    return violations;
  }

  private static String describe(List<Violation> violations) {
    return "Validation failed: " + violations.stream()
        .map(Violation::toString)
        .collect(Collectors.joining("; "));
  }
}
