package notestore.domain;

import jakarta.validation.Valid;
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
 * A place to perform, with its characteristics and the performances given there.
 */
public record Venue(
    @NotNull @Pattern(regexp = Constraints.UUID) String id,
    @NotBlank @Size(max = 200) String name,
    @NotBlank @Size(max = 500) String location,
    @NotNull @Valid VenueCharacteristics characteristics,
    @Size(max = 1000) String description,
    List<@Pattern(regexp = Constraints.UUID) String> contacts,
    List<@Valid VenuePerformance> performanceHistory,
    @NotNull Instant createdAt,
    @NotNull Instant updatedAt,
    @Min(1) Integer version
) implements Entity {

  public Venue {
    contacts = Constraints.list(contacts);
    performanceHistory = Constraints.list(performanceHistory);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id).name(name).location(location).characteristics(characteristics)
        .description(description).contacts(contacts).performanceHistory(performanceHistory)
        .createdAt(createdAt).updatedAt(updatedAt).version(version);
  }

  public static final class Builder {
    private String id;
    private String name;
    private String location;
    private VenueCharacteristics characteristics = VenueCharacteristics.empty();
    private String description;
    private List<String> contacts = new ArrayList<>();
    private List<VenuePerformance> performanceHistory = new ArrayList<>();
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

    public Builder location(String location) {
      this.location = location;
      return this;
    }

    public Builder characteristics(VenueCharacteristics characteristics) {
      this.characteristics = characteristics;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder contacts(List<String> contacts) {
      this.contacts = new ArrayList<>(contacts);
      return this;
    }

    public Builder performanceHistory(List<VenuePerformance> performanceHistory) {
      this.performanceHistory = new ArrayList<>(performanceHistory);
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

    public Venue build() {
      return new Venue(id, name, location, characteristics, description, contacts,
          performanceHistory, createdAt, updatedAt, version);
    }
  }
}
