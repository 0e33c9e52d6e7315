package notestore.organize;

import notestore.domain.Note;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Similarity scores between notes, all in {@code [0, 1]}.
 *
 * <p>Text similarity is the Jaccard index of the lower-cased word sets, ignoring words of
 * two characters or fewer. Note similarity weighs content 0.7, tags 0.2 and duration 0.1.
 */
public final class TextSimilarity {
  private static final double CONTENT_WEIGHT = 0.7;
  private static final double TAG_WEIGHT = 0.2;
  private static final double DURATION_WEIGHT = 0.1;
  private static final Duration SAME_SESSION = Duration.ofHours(24);

  private TextSimilarity() {}

  public static double text(String a, String b) {
    Set<String> left = words(a);
    Set<String> right = words(b);
    return jaccard(left, right);
  }

  /**
   * Like {@link #text} but treats strings equal ignoring case and surrounding blanks as
   * identical, so short names without long words still compare.
   */
  public static double label(String a, String b) {
    if (a != null && b != null && a.trim().equalsIgnoreCase(b.trim())) {
      return 1;
    }
    return text(a, b);
  }

  public static double tags(List<String> a, List<String> b) {
    return jaccard(lowerCase(a), lowerCase(b));
  }

  public static double duration(Note a, Note b) {
    double first = DurationEstimator.durationOf(a);
    double second = DurationEstimator.durationOf(b);
    double max = Math.max(first, second);
    return max == 0 ? 1 : Math.min(first, second) / max;
  }

  public static double notes(Note a, Note b) {
    return text(a.content(), b.content()) * CONTENT_WEIGHT
        + tags(a.tags(), b.tags()) * TAG_WEIGHT
        + duration(a, b) * DURATION_WEIGHT;
  }

  /**
   * Human readable reasons two notes look alike.
   */
  public static List<String> reasons(Note a, Note b) {
    List<String> reasons = new ArrayList<>();
    double content = text(a.content(), b.content());
    if (content > 0.6) {
      reasons.add("Similar content (" + Math.round(content * 100) + "% match)");
    }
    double tags = tags(a.tags(), b.tags());
    if (tags > 0.5) {
      reasons.add("Similar tags (" + Math.round(tags * 100) + "% match)");
    }
    if (a.venue() != null && Objects.equals(a.venue(), b.venue())) {
      reasons.add("Same venue");
    }
    if (a.audience() != null && Objects.equals(a.audience(), b.audience())) {
      reasons.add("Same audience type");
    }
    if (Duration.between(a.createdAt(), b.createdAt()).abs().compareTo(SAME_SESSION) < 0) {
      reasons.add("Created within 24 hours");
    }
    return reasons;
  }

  private static Set<String> words(String text) {
    Set<String> words = new HashSet<>();
    if (text == null) {
      return words;
    }
    for (String word : text.toLowerCase(Locale.ROOT).split("\\s+")) {
      if (word.length() > 2) {
        words.add(word);
      }
    }
    return words;
  }

  private static Set<String> lowerCase(List<String> values) {
    Set<String> result = new HashSet<>();
    for (String value : values) {
      result.add(value.toLowerCase(Locale.ROOT));
    }
    return result;
  }

  private static double jaccard(Set<String> a, Set<String> b) {
    Set<String> union = new HashSet<>(a);
    union.addAll(b);
    if (union.isEmpty()) {
      return 0;
    }
    Set<String> intersection = new HashSet<>(a);
    intersection.retainAll(b);
    return intersection.size() / (double) union.size();
  }
}
