package notestore.domain;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * Entry of a venue's performance history. {@code id} is the linked performance's id.
 */
public record VenuePerformance(
    @NotNull @Pattern(regexp = Constraints.UUID) String id,
    @Pattern(regexp = Constraints.UUID) String setListId,
    @NotNull Instant date,
    @DecimalMin("0") double duration,
    @Min(1) Integer audienceSize,
    @DecimalMin("1") @DecimalMax("5") Double rating,
    @Size(max = 1000) String notes,
    @NotNull Instant createdAt
) {}
