package notestore.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Locale;

/**
 * Comparison helpers over JSON values, shared by every store implementation that filters,
 * sorts or searches outside the database.
 */
public final class JsonValues {

  /**
   * Orders numbers numerically, ISO-8601 instants chronologically, other text lexically and
   * booleans false-first. Values of different kinds are ordered by kind.
   */
  public static final Comparator<JsonNode> NATURAL_ORDER = JsonValues::compare;

  private JsonValues() {}

  /**
   * Filter test: equal values match; when {@code actual} is an array, any equal element matches.
   */
  public static boolean matches(JsonNode actual, JsonNode expected) {
    if (actual == null || actual.isMissingNode() || actual.isNull()) {
      return expected == null || expected.isNull();
    }
    if (actual.isArray() && !expected.isArray()) {
      for (JsonNode element : actual) {
        if (sameValue(element, expected)) {
          return true;
        }
      }
      return false;
    }
    return sameValue(actual, expected);
  }

  /**
   * Case-insensitive substring test; for arrays, each string element is tested.
   *
   * @param needle lower-cased search text
   */
  public static boolean containsText(JsonNode value, String needle) {
    if (value == null) {
      return false;
    }
    if (value.isTextual()) {
      return value.asText().toLowerCase(Locale.ROOT).contains(needle);
    }
    if (value.isArray()) {
      for (JsonNode element : value) {
        if (element.isTextual() && element.asText().toLowerCase(Locale.ROOT).contains(needle)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * True if the field is absent or JSON null.
   */
  public static boolean isAbsent(JsonNode value) {
    return value == null || value.isMissingNode() || value.isNull();
  }

  private static boolean sameValue(JsonNode a, JsonNode b) {
    if (a.isNumber() && b.isNumber()) {
      return a.decimalValue().compareTo(b.decimalValue()) == 0;
    }
    return a.equals(b);
  }

  private static int compare(JsonNode a, JsonNode b) {
    if (a.isNumber() && b.isNumber()) {
      return a.decimalValue().compareTo(b.decimalValue());
    }
    if (a.isTextual() && b.isTextual()) {
      Instant left = asInstant(a.asText());
      Instant right = left == null ? null : asInstant(b.asText());
      if (left != null && right != null) {
        return left.compareTo(right);
      }
      return a.asText().compareTo(b.asText());
    }
    if (a.isBoolean() && b.isBoolean()) {
      return Boolean.compare(a.booleanValue(), b.booleanValue());
    }
    return a.getNodeType().compareTo(b.getNodeType());
  }

  private static Instant asInstant(String text) {
    if (text.length() < 20 || text.charAt(4) != '-' || text.charAt(10) != 'T') {
      return null;
    }
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
