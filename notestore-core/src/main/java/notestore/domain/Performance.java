package notestore.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import notestore.Entity;

import java.time.Instant;

/**
 * A set list performed (or scheduled) at a venue.
 */
public record Performance(
    @NotNull @Pattern(regexp = Constraints.UUID) String id,
    @NotNull @Pattern(regexp = Constraints.UUID) String setListId,
    @NotNull @Pattern(regexp = Constraints.UUID) String venueId,
    @NotNull Instant date,
    Instant startTime,
    Instant endTime,
    @DecimalMin("0") Double actualDuration,
    @Valid PerformanceFeedback feedback,
    @Size(max = 2000) String notes,
    @NotNull PerformanceStatus status,
    @NotNull Instant createdAt,
    @NotNull Instant updatedAt,
    @Min(1) Integer version
) implements Entity {

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id).setListId(setListId).venueId(venueId).date(date).startTime(startTime)
        .endTime(endTime).actualDuration(actualDuration).feedback(feedback).notes(notes)
        .status(status).createdAt(createdAt).updatedAt(updatedAt).version(version);
  }

  public static final class Builder {
    private String id;
    private String setListId;
    private String venueId;
    private Instant date;
    private Instant startTime;
    private Instant endTime;
    private Double actualDuration;
    private PerformanceFeedback feedback;
    private String notes;
    private PerformanceStatus status = PerformanceStatus.SCHEDULED;
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

    public Builder venueId(String venueId) {
      this.venueId = venueId;
      return this;
    }

    public Builder date(Instant date) {
      this.date = date;
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

    public Builder actualDuration(Double actualDuration) {
      this.actualDuration = actualDuration;
      return this;
    }

    public Builder feedback(PerformanceFeedback feedback) {
      this.feedback = feedback;
      return this;
    }

    public Builder notes(String notes) {
      this.notes = notes;
      return this;
    }

    public Builder status(PerformanceStatus status) {
      this.status = status;
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

    public Performance build() {
      return new Performance(id, setListId, venueId, date, startTime, endTime, actualDuration,
          feedback, notes, status, createdAt, updatedAt, version);
    }
  }
}
