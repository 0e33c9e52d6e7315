package notestore.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Time spent on one note during a rehearsal, in seconds from the session start.
 */
public record NoteTiming(
    @NotNull @Pattern(regexp = Constraints.UUID) String noteId,
    @DecimalMin("0") double startTime,
    @DecimalMin("0") Double endTime,
    @DecimalMin("0") Double duration
) {}
