package notestore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * A logged exchange with a contact.
 */
public record Interaction(
    @NotNull @Pattern(regexp = Constraints.UUID) String id,
    @NotNull Type type,
    @NotBlank @Size(max = 200) String subject,
    @Size(max = 1000) String notes,
    @NotNull Instant date,
    @NotNull Instant createdAt
) {

  public enum Type {
    @JsonProperty("email") EMAIL,
    @JsonProperty("phone") PHONE,
    @JsonProperty("meeting") MEETING,
    @JsonProperty("performance") PERFORMANCE,
    @JsonProperty("social") SOCIAL
  }
}
