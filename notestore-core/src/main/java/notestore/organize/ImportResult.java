package notestore.organize;

import java.util.List;

/**
 * Outcome of an import. Rows that failed validation are reported in {@code errors} and
 * do not stop the import.
 */
public record ImportResult(boolean success, Counts imported, List<String> errors, int duplicatesFound) {

  public ImportResult {
    errors = List.copyOf(errors);
  }

  public record Counts(int notes, int setlists, int venues, int contacts) {}
}
