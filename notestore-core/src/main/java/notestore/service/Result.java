package notestore.service;

import notestore.EntityNotFoundException;
import notestore.ValidationException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of a domain service call whose failure is expected and recoverable.
 *
 * <ul>
 *   <li>{@link Ok} carries the value.</li>
 *   <li>{@link NotFound} means the addressed entity does not exist.</li>
 *   <li>{@link Invalid} means the input violated the collection's constraints.</li>
 * </ul>
 *
 * <p>Storage failures are not represented here; they propagate as
 * {@link notestore.StorageUnavailableException}.
 *
 * @param <T> the value type
 */
public sealed interface Result<T> permits Result.Ok, Result.NotFound, Result.Invalid {

  static <T> Result<T> ok(T value) {
    return new Ok<>(value);
  }

  static <T> Result<T> notFound(String message) {
    return new NotFound<>(message);
  }

  static <T> Result<T> invalid(ValidationException e) {
    return new Invalid<>(e.getMessage(), e.violations());
  }

  /**
   * Runs an action, mapping {@link EntityNotFoundException} and {@link ValidationException}
   * to their result variants. Other exceptions propagate.
   */
  static <T> Result<T> of(Supplier<T> action) {
    try {
      return ok(action.get());
    } catch (EntityNotFoundException e) {
      return notFound(e.getMessage());
    } catch (ValidationException e) {
      return invalid(e);
    }
  }

  default boolean isOk() {
    return this instanceof Ok;
  }

  /**
   * Returns the value or throws if this is not {@link Ok}.
   *
   * @throws IllegalStateException describing the failure
   */
  default T orElseThrow() {
    if (this instanceof Ok<T> ok) {
      return ok.value();
    }
    throw new IllegalStateException(String.valueOf(this));
  }

  default Optional<T> toOptional() {
    return this instanceof Ok<T> ok ? Optional.ofNullable(ok.value()) : Optional.empty();
  }

  @SuppressWarnings("unchecked")
  default <R> Result<R> map(Function<? super T, ? extends R> mapper) {
    if (this instanceof Ok<T> ok) {
      return ok(mapper.apply(ok.value()));
    }
    return (Result<R>) this;
  }

  /**
   * Successful outcome.
   */
  record Ok<T>(T value) implements Result<T> {
  }

  /**
   * The addressed entity does not exist.
   */
  record NotFound<T>(String message) implements Result<T> {
    public NotFound {
      Objects.requireNonNull(message, "message");
    }
  }

  /**
   * The input was rejected by validation.
   */
  record Invalid<T>(String message, List<ValidationException.Violation> violations)
      implements Result<T> {
    public Invalid {
      Objects.requireNonNull(message, "message");
      violations = List.copyOf(violations);
    }
  }
}
