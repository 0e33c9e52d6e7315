package notestore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A partial update of an entity's top-level fields.
 *
 * <p>A field is either set to a non-null value or explicitly unset (removed). Fields not
 * mentioned keep their stored value. Values are converted to JSON with the store's codec,
 * so records, enums, lists and {@link java.time.Instant}s can be passed directly.
 *
 * <pre>{@code
 * Patch patch = Patch.builder()
 *     .set("content", "Updated bit")
 *     .unset("venue")
 *     .build();
 * }</pre>
 */
public final class Patch {
  private final Map<String, Object> values;
  private final Set<String> unset;

  private Patch(Map<String, Object> values, Set<String> unset) {
    this.values = Collections.unmodifiableMap(values);
    this.unset = Collections.unmodifiableSet(unset);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Patch setting a single field.
   */
  public static Patch of(String field, Object value) {
    return builder().set(field, value).build();
  }

  /**
   * Fields set by this patch, in insertion order.
   */
  public Map<String, Object> values() {
    return values;
  }

  /**
   * Fields removed by this patch.
   */
  public Set<String> unset() {
    return unset;
  }

  public boolean touches(String field) {
    return values.containsKey(field) || unset.contains(field);
  }

  public boolean isEmpty() {
    return values.isEmpty() && unset.isEmpty();
  }

  /**
   * Returns a builder pre-populated with this patch, for derived patches.
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.values.putAll(values);
    builder.unset.addAll(unset);
    return builder;
  }

  @Override
  public String toString() {
    return "Patch{set=" + values.keySet() + ", unset=" + unset + '}';
  }

  public static final class Builder {
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Set<String> unset = new LinkedHashSet<>();

    private Builder() {}

    /**
     * Sets a field. Use {@link #unset(String)} to clear one; {@code null} is rejected.
     */
    public Builder set(String field, Object value) {
      Objects.requireNonNull(field, "field");
      if (value == null) {
        throw new IllegalArgumentException("null value for '" + field + "', use unset()");
      }
      unset.remove(field);
      values.put(field, value);
      return this;
    }

    public Builder unset(String field) {
      Objects.requireNonNull(field, "field");
      values.remove(field);
      unset.add(field);
      return this;
    }

    public Builder remove(String field) {
      values.remove(field);
      unset.remove(field);
      return this;
    }

    public Patch build() {
      return new Patch(new LinkedHashMap<>(values), new LinkedHashSet<>(unset));
    }
  }
}
