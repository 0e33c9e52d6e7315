package notestore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.Instant;

public record SetListFeedback(
    @NotNull @Pattern(regexp = Constraints.UUID) String id,
    @Min(1) @Max(5) int rating,
    @Size(max = 2000) String notes,
    Response audienceResponse,
    @NotNull Instant createdAt
) {

  public enum Response {
    @JsonProperty("excellent") EXCELLENT,
    @JsonProperty("good") GOOD,
    @JsonProperty("mixed") MIXED,
    @JsonProperty("poor") POOR
  }
}
