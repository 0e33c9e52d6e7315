package notestore.organize;

/**
 * @param skipDuplicates      skip rows that resemble an existing row
 * @param similarityThreshold similarity, in {@code [0, 1]}, that a row must exceed to count
 *                            as a duplicate
 */
public record ImportOptions(boolean skipDuplicates, double similarityThreshold) {
  public static final double DEFAULT_THRESHOLD = 0.9;

  public ImportOptions {
    if (similarityThreshold < 0 || similarityThreshold > 1) {
      throw new IllegalArgumentException("similarityThreshold must be between 0 and 1");
    }
  }

  /**
   * Imports every row.
   */
  public static ImportOptions all() {
    return new ImportOptions(false, DEFAULT_THRESHOLD);
  }

  public static ImportOptions skippingDuplicates() {
    return new ImportOptions(true, DEFAULT_THRESHOLD);
  }
}
