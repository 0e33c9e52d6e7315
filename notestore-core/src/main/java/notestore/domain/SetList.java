package notestore.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import notestore.Entity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * An ordered selection of notes for one performance.
 *
 * <p>Member notes are embedded snapshots; they may refer to notes that have since been
 * edited or deleted. {@code totalDuration} is derived from the members and recomputed by
 * {@link notestore.service.SetListService} on every write.
 */
public record SetList(
    @NotNull @Pattern(regexp = Constraints.UUID) String id,
    @NotBlank @Size(max = 200) String name,
    @Size(max = 100) List<@Valid Note> notes,
    @DecimalMin("0") double totalDuration,
    @Size(max = 200) String venue,
    Instant performanceDate,
    @Size(max = 1000) String description,
    List<@Valid SetListFeedback> feedback,
    @NotNull Instant createdAt,
    @NotNull Instant updatedAt,
    @Min(1) Integer version
) implements Entity {

  public SetList {
    notes = Constraints.list(notes);
    feedback = Constraints.list(feedback);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id).name(name).notes(notes).totalDuration(totalDuration).venue(venue)
        .performanceDate(performanceDate).description(description).feedback(feedback)
        .createdAt(createdAt).updatedAt(updatedAt).version(version);
  }

  public static final class Builder {
    private String id;
    private String name;
    private List<Note> notes = new ArrayList<>();
    private double totalDuration;
    private String venue;
    private Instant performanceDate;
    private String description;
    private List<SetListFeedback> feedback = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;
    private Integer version;

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder notes(List<Note> notes) {
      this.notes = new ArrayList<>(notes);
      return this;
    }

    public Builder note(Note note) {
      this.notes.add(note);
      return this;
    }

    public Builder totalDuration(double totalDuration) {
      this.totalDuration = totalDuration;
      return this;
    }

    public Builder venue(String venue) {
      this.venue = venue;
      return this;
    }

    public Builder performanceDate(Instant performanceDate) {
      this.performanceDate = performanceDate;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder feedback(List<SetListFeedback> feedback) {
      this.feedback = new ArrayList<>(feedback);
      return this;
    }

    public Builder createdAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder updatedAt(Instant updatedAt) {
      this.updatedAt = updatedAt;
      return this;
    }

    public Builder version(Integer version) {
      this.version = version;
      return this;
    }

    public SetList build() {
      return new SetList(id, name, notes, totalDuration, venue, performanceDate, description,
          feedback, createdAt, updatedAt, version);
    }
  }
}
