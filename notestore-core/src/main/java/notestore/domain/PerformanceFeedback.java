package notestore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

public record PerformanceFeedback(
    String id,
    String performanceId,
    @DecimalMin("1") @DecimalMax("5") double rating,
    @Min(1) Integer audienceSize,
    AudienceResponse audienceResponse,
    @Size(max = 2000) String notes,
    List<@Size(max = 500) String> highlights,
    List<@Size(max = 500) String> improvements,
    List<@Valid MaterialFeedback> materialFeedback,
    Instant createdAt
) {

  public PerformanceFeedback {
    highlights = Constraints.list(highlights);
    improvements = Constraints.list(improvements);
    materialFeedback = Constraints.list(materialFeedback);
  }

  public static PerformanceFeedback rated(double rating, List<MaterialFeedback> materialFeedback) {
    return new PerformanceFeedback(null, null, rating, null, null, null, null, null,
        materialFeedback, null);
  }

  public enum AudienceResponse {
    @JsonProperty("poor") POOR,
    @JsonProperty("fair") FAIR,
    @JsonProperty("good") GOOD,
    @JsonProperty("great") GREAT,
    @JsonProperty("excellent") EXCELLENT
  }
}
