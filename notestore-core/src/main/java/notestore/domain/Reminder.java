package notestore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * A follow-up due for a contact.
 */
public record Reminder(
    @NotNull @Pattern(regexp = Constraints.UUID) String id,
    @NotBlank @Size(max = 200) String title,
    @Size(max = 1000) String description,
    @NotNull Instant dueDate,
    boolean completed,
    Instant completedAt,
    Priority priority,
    @Size(max = 500) String context,
    @NotNull Instant createdAt
) {

  public Reminder complete(Instant at) {
    return new Reminder(id, title, description, dueDate, true, at, priority, context, createdAt);
  }

  public enum Priority {
    @JsonProperty("low") LOW,
    @JsonProperty("medium") MEDIUM,
    @JsonProperty("high") HIGH
  }
}
