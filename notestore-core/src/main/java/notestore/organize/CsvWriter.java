package notestore.organize;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Minimal RFC 4180 style writer: fields containing a comma, a double quote or a line
 * break are wrapped in double quotes, with embedded quotes doubled. Rows end with
 * {@code \n}; the last row has no terminator.
 */
final class CsvWriter {
  private final StringBuilder out = new StringBuilder();
  private boolean firstRow = true;

  CsvWriter row(List<?> fields) {
    if (!firstRow) {
      out.append('\n');
    }
    firstRow = false;
    for (int i = 0; i < fields.size(); i++) {
      if (i > 0) {
        out.append(',');
      }
      out.append(escape(format(fields.get(i))));
    }
    return this;
  }

  static String escape(String field) {
    if (field.indexOf(',') < 0 && field.indexOf('"') < 0
        && field.indexOf('\n') < 0 && field.indexOf('\r') < 0) {
      return field;
    }
    return '"' + field.replace("\"", "\"\"") + '"';
  }

  /**
   * Empty for null, ISO-8601 for instants, integral numbers without a fraction.
   */
  static String format(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Instant instant) {
      return instant.toString();
    }
    if (value instanceof Double || value instanceof Float) {
      return BigDecimal.valueOf(((Number) value).doubleValue()).stripTrailingZeros().toPlainString();
    }
    return value.toString();
  }

  @Override
  public String toString() {
    return out.toString();
  }
}
