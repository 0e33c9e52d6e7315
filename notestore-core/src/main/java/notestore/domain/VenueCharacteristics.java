package notestore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

public record VenueCharacteristics(
    @Min(1) @Max(100_000) Integer audienceSize,
    @Size(max = 100) String audienceType,
    Acoustics acoustics,
    Lighting lighting,
    StageSize stageSize,
    @Size(max = 100) String microphoneType
) {

  public static VenueCharacteristics empty() {
    return new VenueCharacteristics(null, null, null, null, null, null);
  }

  public enum Acoustics {
    @JsonProperty("excellent") EXCELLENT,
    @JsonProperty("good") GOOD,
    @JsonProperty("poor") POOR
  }

  public enum Lighting {
    @JsonProperty("professional") PROFESSIONAL,
    @JsonProperty("basic") BASIC,
    @JsonProperty("minimal") MINIMAL
  }

  public enum StageSize {
    @JsonProperty("large") LARGE,
    @JsonProperty("medium") MEDIUM,
    @JsonProperty("small") SMALL
  }
}
