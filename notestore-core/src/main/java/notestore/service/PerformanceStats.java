package notestore.service;

import java.util.List;

/**
 * Aggregates over completed performances that have feedback.
 *
 * @param bestVenue the venue with the highest average rating, or {@code null} if none
 */
public record PerformanceStats(
    int totalPerformances,
    double averageRating,
    double totalStageTime,
    BestVenue bestVenue,
    List<MaterialStat> topMaterial,
    Trend recentTrend,
    List<MonthlyStat> monthlyBreakdown
) {
  static final PerformanceStats EMPTY = new PerformanceStats(0, 0, 0, null, List.of(),
      new Trend(Direction.STABLE, 0), List.of());

  public record BestVenue(String venueId, String venueName, double averageRating, int performanceCount) {}

  /**
   * @param noteContent first 100 characters of the note as stored in the set list
   */
  public record MaterialStat(String noteId, String noteContent, int timesPerformed, double averageRating) {}

  public record Trend(Direction direction, double ratingChange) {}

  /**
   * @param month {@code YYYY-MM} in UTC
   */
  public record MonthlyStat(String month, int performanceCount, double averageRating, double totalDuration) {}

  public enum Direction {
    IMPROVING,
    DECLINING,
    STABLE
  }
}
