package notestore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Substring search over named text fields of one collection.
 *
 * <p>Filters are applied first, with the same semantics as {@link ListOptions}. A row then
 * matches if any of {@link #fields()} contains {@link #text()} ignoring case; for array
 * fields each string element is tested on its own. A blank text or an empty field list
 * disables the text test. There is no ranking: results come back in primary-key order.
 */
public final class SearchQuery {
  private final String text;
  private final List<String> fields;
  private final Map<String, Object> filters;
  private final Integer limit;

  private SearchQuery(Builder builder) {
    this.text = builder.text;
    this.fields = List.copyOf(builder.fields);
    this.filters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.filters));
    this.limit = builder.limit;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Convenience factory for a plain text search over the given fields.
   */
  public static SearchQuery of(String text, String... fields) {
    return builder().text(text).fields(fields).build();
  }

  public String text() {
    return text;
  }

  public List<String> fields() {
    return fields;
  }

  public Map<String, Object> filters() {
    return filters;
  }

  public Integer limit() {
    return limit;
  }

  public boolean hasText() {
    return text != null && !text.isBlank() && !fields.isEmpty();
  }

  public SearchQuery withLimit(Integer newLimit) {
    Builder builder = builder().text(text).fields(fields.toArray(String[]::new));
    builder.filters.putAll(filters);
    builder.limit = newLimit;
    return builder.build();
  }

  @Override
  public String toString() {
    return "SearchQuery{text=" + text + ", fields=" + fields + ", filters=" + filters
        + ", limit=" + limit + '}';
  }

  public static final class Builder {
    private String text;
    private List<String> fields = List.of();
    private final Map<String, Object> filters = new LinkedHashMap<>();
    private Integer limit;

    private Builder() {}

    public Builder text(String text) {
      this.text = text;
      return this;
    }

    public Builder fields(String... fields) {
      this.fields = List.of(fields);
      return this;
    }

    public Builder filter(String field, Object value) {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(value, "value");
      filters.put(field, value);
      return this;
    }

    public Builder limit(int limit) {
      if (limit < 0) {
        throw new IllegalArgumentException("limit must be >= 0");
      }
      this.limit = limit;
      return this;
    }

    public SearchQuery build() {
      return new SearchQuery(this);
    }
  }
}
