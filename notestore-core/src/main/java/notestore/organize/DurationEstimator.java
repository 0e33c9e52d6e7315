package notestore.organize;

import notestore.domain.Note;

/**
 * Spoken-length heuristics for notes without a declared duration.
 */
public final class DurationEstimator {
  static final double WORDS_PER_MINUTE = 150;
  static final double MINIMUM_SECONDS = 10;
  static final double SHORT_MAX_SECONDS = 120;
  static final double MEDIUM_MAX_SECONDS = 300;

  private DurationEstimator() {}

  /**
   * Seconds needed to say the text at 150 words per minute, never less than 10.
   */
  public static double estimate(String content) {
    String trimmed = content == null ? "" : content.trim();
    int words = trimmed.isEmpty() ? 1 : trimmed.split("\\s+").length;
    return Math.max(words / WORDS_PER_MINUTE * 60, MINIMUM_SECONDS);
  }

  /**
   * The note's {@code estimatedDuration} when set and non-zero, otherwise the estimate.
   */
  public static double durationOf(Note note) {
    Double declared = note.estimatedDuration();
    return declared != null && declared != 0 ? declared : estimate(note.content());
  }

  public static DurationCategory categorize(double seconds) {
    if (seconds <= SHORT_MAX_SECONDS) {
      return DurationCategory.SHORT;
    }
    if (seconds <= MEDIUM_MAX_SECONDS) {
      return DurationCategory.MEDIUM;
    }
    return DurationCategory.LONG;
  }
}
