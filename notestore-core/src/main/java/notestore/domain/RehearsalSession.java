package notestore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import notestore.Entity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A timed run-through of a set list.
 */
public record RehearsalSession(
    @NotNull @Pattern(regexp = Constraints.UUID) String id,
    @NotNull @Pattern(regexp = Constraints.UUID) String setListId,
    @NotNull Instant startTime,
    Instant endTime,
    @DecimalMin("0") double totalDuration,
    @Min(0) int currentNoteIndex,
    List<@Valid NoteTiming> noteTimings,
    @JsonProperty("isCompleted") boolean completed,
    @NotNull Instant createdAt,
    @NotNull Instant updatedAt,
    @Min(1) Integer version
) implements Entity {

  public RehearsalSession {
    noteTimings = Constraints.list(noteTimings);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id).setListId(setListId).startTime(startTime).endTime(endTime)
        .totalDuration(totalDuration).currentNoteIndex(currentNoteIndex).noteTimings(noteTimings)
        .completed(completed).createdAt(createdAt).updatedAt(updatedAt).version(version);
  }

  public static final class Builder {
    private String id;
    private String setListId;
    private Instant startTime;
    private Instant endTime;
    private double totalDuration;
    private int currentNoteIndex;
    private List<NoteTiming> noteTimings = new ArrayList<>();
    private boolean completed;
    private Instant createdAt;
    private Instant updatedAt;
    private Integer version;

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder setListId(String setListId) {
      this.setListId = setListId;
      return this;
    }

    public Builder startTime(Instant startTime) {
      this.startTime = startTime;
      return this;
    }

    public Builder endTime(Instant endTime) {
      this.endTime = endTime;
      return this;
    }

    public Builder totalDuration(double totalDuration) {
      this.totalDuration = totalDuration;
      return this;
    }

    public Builder currentNoteIndex(int currentNoteIndex) {
      this.currentNoteIndex = currentNoteIndex;
      return this;
    }

    public Builder noteTimings(List<NoteTiming> noteTimings) {
      this.noteTimings = new ArrayList<>(noteTimings);
      return this;
    }

    public Builder completed(boolean completed) {
      this.completed = completed;
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

    public RehearsalSession build() {
      return new RehearsalSession(id, setListId, startTime, endTime, totalDuration,
          currentNoteIndex, noteTimings, completed, createdAt, updatedAt, version);
    }
  }
}
