package notestore.domain;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * How one note landed during a performance.
 */
public record MaterialFeedback(
    @NotNull @Pattern(regexp = Constraints.UUID) String noteId,
    @DecimalMin("1") @DecimalMax("5") double rating,
    @Size(max = 500) String notes
) {}
