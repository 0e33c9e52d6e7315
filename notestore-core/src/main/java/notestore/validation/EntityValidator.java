package notestore.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import notestore.ValidationException;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Checks values against the Bean Validation constraints declared on the domain records.
 *
 * <p>Uses Hibernate Validator with parameter-only message interpolation, so no expression
 * language implementation is required at runtime.
 */
public final class EntityValidator {
  private static final EntityValidator DEFAULT = new EntityValidator(buildDefaultValidator());

  private final Validator validator;

  public EntityValidator(Validator validator) {
    this.validator = Objects.requireNonNull(validator, "validator");
  }

  public static EntityValidator getDefault() {
    return DEFAULT;
  }

  /**
   * Validates a value and its nested {@code @Valid} members.
   *
   * @return the same value, for chaining
   * @throws ValidationException listing every violation, sorted by property path
   */
  public <T> T validate(T value) {
    Objects.requireNonNull(value, "value");
    Set<ConstraintViolation<T>> violations = validator.validate(value);
    if (!violations.isEmpty()) {
      List<ValidationException.Violation> details = violations.stream()
          .map(v -> new ValidationException.Violation(v.getPropertyPath().toString(), v.getMessage()))
          .sorted(Comparator.comparing(ValidationException.Violation::path))
          .toList();
      throw new ValidationException(details);
    }
    return value;
  }

  private static Validator buildDefaultValidator() {
    ValidatorFactory factory = Validation.byDefaultProvider()
        .configure()
        .messageInterpolator(new ParameterMessageInterpolator())
        .buildValidatorFactory();
    return factory.getValidator();
  }
}
