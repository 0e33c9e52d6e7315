package notestore.service;

import notestore.EntityType;
import notestore.ListOptions;
import notestore.Patch;
import notestore.SortOrder;
import notestore.domain.MaterialFeedback;
import notestore.domain.Note;
import notestore.domain.Performance;
import notestore.domain.PerformanceStatus;
import notestore.domain.SetList;
import notestore.domain.Venue;
import notestore.spi.EntityStore;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Performances and the statistics derived from their feedback.
 */
public final class PerformanceService {
  static final String[] SEARCH_FIELDS = {"notes"};

  private static final DateTimeFormatter MONTH =
      DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);
  private static final int TREND_WINDOW = 5;
  private static final double TREND_THRESHOLD = 0.2;
  private static final int TOP_MATERIAL = 10;
  private static final int CONTENT_PREVIEW = 100;

  private final EntityStore store;

  public PerformanceService(EntityStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  public Result<Performance> create(Performance performance) {
    return Result.of(() -> store.create(EntityType.PERFORMANCES, performance));
  }

  public Optional<Performance> get(String id) {
    return store.read(EntityType.PERFORMANCES, id);
  }

  public Result<Performance> update(String id, Patch patch) {
    return Result.of(() -> store.update(EntityType.PERFORMANCES, id, patch));
  }

  public void delete(String id) {
    store.delete(EntityType.PERFORMANCES, id);
  }

  public List<Performance> list(ListOptions options) {
    return store.list(EntityType.PERFORMANCES, options);
  }

  /**
   * All performances, most recent date first.
   */
  public List<Performance> list() {
    return list(ListOptions.builder().sortBy("date", SortOrder.DESC).build());
  }

  public List<Performance> listByVenue(String venueId) {
    return list(ListOptions.builder().filter("venueId", venueId).sortBy("date", SortOrder.DESC).build());
  }

  public List<Performance> listByStatus(PerformanceStatus status) {
    return list(ListOptions.builder().filter("status", status).sortBy("date", SortOrder.DESC).build());
  }

  /**
   * Computes statistics over completed performances with feedback.
   *
   * <p>The trend compares the average rating of the five most recent performances with the
   * five before them and needs at least ten; a change beyond 0.2 either way counts as
   * improving or declining.
   */
  public PerformanceStats stats() {
    List<Performance> completed = new ArrayList<>();
    for (Performance performance : list()) {
      if (performance.status() == PerformanceStatus.COMPLETED && performance.feedback() != null) {
        completed.add(performance);
      }
    }
    if (completed.isEmpty()) {
      return PerformanceStats.EMPTY;
    }

    int total = completed.size();
    double ratingSum = 0;
    double stageTime = 0;
    for (Performance performance : completed) {
      ratingSum += performance.feedback().rating();
      stageTime += performance.actualDuration() == null ? 0 : performance.actualDuration();
    }

    return new PerformanceStats(
        total,
        ratingSum / total,
        stageTime,
        bestVenue(completed),
        topMaterial(completed),
        trend(completed),
        monthlyBreakdown(completed));
  }

  private PerformanceStats.BestVenue bestVenue(List<Performance> completed) {
    Map<String, Tally> byVenue = new LinkedHashMap<>();
    Map<String, String> names = new HashMap<>();
    for (Performance performance : completed) {
      Optional<Venue> venue = store.read(EntityType.VENUES, performance.venueId());
      if (venue.isEmpty()) {
        continue;
      }
      names.put(performance.venueId(), venue.get().name());
      byVenue.computeIfAbsent(performance.venueId(), id -> new Tally())
          .add(performance.feedback().rating(), 0);
    }
    PerformanceStats.BestVenue best = null;
    for (Map.Entry<String, Tally> entry : byVenue.entrySet()) {
      Tally tally = entry.getValue();
      if (best == null || tally.average() > best.averageRating()) {
        best = new PerformanceStats.BestVenue(entry.getKey(), names.get(entry.getKey()),
            tally.average(), tally.count);
      }
    }
    return best;
  }

  private List<PerformanceStats.MaterialStat> topMaterial(List<Performance> completed) {
    Map<String, Tally> byNote = new LinkedHashMap<>();
    Map<String, String> previews = new HashMap<>();
    Map<String, Optional<SetList>> setLists = new HashMap<>();
    for (Performance performance : completed) {
      Optional<SetList> setList = setLists.computeIfAbsent(performance.setListId(),
          id -> store.read(EntityType.SETLISTS, id));
      if (setList.isEmpty()) {
        continue;
      }
      for (MaterialFeedback feedback : performance.feedback().materialFeedback()) {
        Optional<Note> note = setList.get().notes().stream()
            .filter(n -> feedback.noteId().equals(n.id()))
            .findFirst();
        if (note.isEmpty()) {
          continue;
        }
        String content = note.get().content();
        previews.putIfAbsent(feedback.noteId(),
            content.length() > CONTENT_PREVIEW ? content.substring(0, CONTENT_PREVIEW) : content);
        byNote.computeIfAbsent(feedback.noteId(), id -> new Tally()).add(feedback.rating(), 0);
      }
    }
    return byNote.entrySet().stream()
        .map(e -> new PerformanceStats.MaterialStat(e.getKey(), previews.get(e.getKey()),
            e.getValue().count, e.getValue().average()))
        .sorted(Comparator.comparingDouble(PerformanceStats.MaterialStat::averageRating).reversed())
        .limit(TOP_MATERIAL)
        .toList();
  }

  private static PerformanceStats.Trend trend(List<Performance> completed) {
    List<Performance> byDate = completed.stream()
        .sorted(Comparator.comparing(Performance::date).reversed())
        .toList();
    if (byDate.size() < 2 * TREND_WINDOW) {
      return new PerformanceStats.Trend(PerformanceStats.Direction.STABLE, 0);
    }
    double change = averageRating(byDate.subList(0, TREND_WINDOW))
        - averageRating(byDate.subList(TREND_WINDOW, 2 * TREND_WINDOW));
    PerformanceStats.Direction direction = change > TREND_THRESHOLD
        ? PerformanceStats.Direction.IMPROVING
        : change < -TREND_THRESHOLD ? PerformanceStats.Direction.DECLINING : PerformanceStats.Direction.STABLE;
    return new PerformanceStats.Trend(direction, change);
  }

  private static List<PerformanceStats.MonthlyStat> monthlyBreakdown(List<Performance> completed) {
    Map<String, Tally> byMonth = new TreeMap<>();
    for (Performance performance : completed) {
      byMonth.computeIfAbsent(MONTH.format(performance.date()), m -> new Tally())
          .add(performance.feedback().rating(),
              performance.actualDuration() == null ? 0 : performance.actualDuration());
    }
    return byMonth.entrySet().stream()
        .map(e -> new PerformanceStats.MonthlyStat(e.getKey(), e.getValue().count,
            e.getValue().average(), e.getValue().duration))
        .toList();
  }

  private static double averageRating(List<Performance> performances) {
    double sum = 0;
    for (Performance performance : performances) {
      sum += performance.feedback().rating();
    }
    return sum / performances.size();
  }

  private static final class Tally {
    int count;
    double rating;
    double duration;

    void add(double value, double seconds) {
      count++;
      rating += value;
      duration += seconds;
    }

    double average() {
      return rating / count;
    }
  }
}
