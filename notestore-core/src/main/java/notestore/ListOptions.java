package notestore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Filtering, sorting and paging of a {@link notestore.spi.EntityStore#list list} call.
 *
 * <p>Each filter is an equality test on a top-level field; when the stored field holds an
 * array the filter matches if any element equals the filter value. Rows lacking the sort
 * field are placed after all others regardless of direction.
 *
 * <pre>{@code
 * ListOptions options = ListOptions.builder()
 *     .filter("captureMethod", CaptureMethod.VOICE)
 *     .sortBy("createdAt", SortOrder.DESC)
 *     .limit(20)
 *     .build();
 * }</pre>
 */
public final class ListOptions {
  public static final String DEFAULT_SORT_FIELD = "createdAt";

  private static final ListOptions DEFAULTS = builder().build();

  private final Map<String, Object> filters;
  private final String sortBy;
  private final SortOrder order;
  private final int offset;
  private final Integer limit;

  private ListOptions(Builder builder) {
    this.filters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.filters));
    this.sortBy = builder.sortBy;
    this.order = builder.order;
    this.offset = builder.offset;
    this.limit = builder.limit;
  }

  /**
   * Options with no filters, sorted by {@code createdAt} descending, unpaged.
   */
  public static ListOptions defaults() {
    return DEFAULTS;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<String, Object> filters() {
    return filters;
  }

  public String sortBy() {
    return sortBy;
  }

  public SortOrder order() {
    return order;
  }

  public int offset() {
    return offset;
  }

  /**
   * @return the maximum number of rows, or {@code null} for no limit
   */
  public Integer limit() {
    return limit;
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.filters.putAll(filters);
    builder.sortBy = sortBy;
    builder.order = order;
    builder.offset = offset;
    builder.limit = limit;
    return builder;
  }

  @Override
  public String toString() {
    return "ListOptions{filters=" + filters + ", sortBy=" + sortBy + ", order=" + order
        + ", offset=" + offset + ", limit=" + limit + '}';
  }

  public static final class Builder {
    private final Map<String, Object> filters = new LinkedHashMap<>();
    private String sortBy = DEFAULT_SORT_FIELD;
    private SortOrder order = SortOrder.DESC;
    private int offset;
    private Integer limit;

    private Builder() {}

    public Builder filter(String field, Object value) {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(value, "value");
      filters.put(field, value);
      return this;
    }

    public Builder filters(Map<String, ?> values) {
      values.forEach(this::filter);
      return this;
    }

    public Builder sortBy(String field, SortOrder order) {
      this.sortBy = Objects.requireNonNull(field, "field");
      this.order = Objects.requireNonNull(order, "order");
      return this;
    }

    public Builder offset(int offset) {
      if (offset < 0) {
        throw new IllegalArgumentException("offset must be >= 0");
      }
      this.offset = offset;
      return this;
    }

    public Builder limit(int limit) {
      if (limit < 0) {
        throw new IllegalArgumentException("limit must be >= 0");
      }
      this.limit = limit;
      return this;
    }

    public ListOptions build() {
      return new ListOptions(this);
    }
  }
}
