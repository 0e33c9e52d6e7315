package notestore.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * Capture context of a note. {@code duration} is the declared spoken length in seconds and
 * feeds set list totals.
 */
public record NoteMetadata(
    @Valid GeoLocation location,
    Instant capturedAt,
    @Size(max = 100) String platform,
    @DecimalMin("0") @DecimalMax("1") Double confidence,
    @DecimalMin("0") Double duration
) {

  public static NoteMetadata ofDuration(double seconds) {
    return new NoteMetadata(null, null, null, null, seconds);
  }
}
