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
 * A person met through performing: booker, host, fellow performer.
 *
 * <p>Interactions and reminders are kept in insertion order.
 */
public record Contact(
    @NotNull @Pattern(regexp = Constraints.UUID) String id,
    @NotBlank @Size(max = 200) String name,
    @NotBlank @Size(max = 100) String role,
    @Pattern(regexp = Constraints.UUID) String venue,
    @NotNull @Valid ContactInfo contactInfo,
    @Size(max = 2000) String notes,
    List<@Valid Interaction> interactions,
    List<@Valid Reminder> reminders,
    @NotNull Instant createdAt,
    @NotNull Instant updatedAt,
    @Min(1) Integer version
) implements Entity {

  public Contact {
    interactions = Constraints.list(interactions);
    reminders = Constraints.list(reminders);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id).name(name).role(role).venue(venue).contactInfo(contactInfo).notes(notes)
        .interactions(interactions).reminders(reminders)
        .createdAt(createdAt).updatedAt(updatedAt).version(version);
  }

  public static final class Builder {
    private String id;
    private String name;
    private String role;
    private String venue;
    private ContactInfo contactInfo = ContactInfo.empty();
    private String notes;
    private List<Interaction> interactions = new ArrayList<>();
    private List<Reminder> reminders = new ArrayList<>();
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

    public Builder role(String role) {
      this.role = role;
      return this;
    }

    public Builder venue(String venue) {
      this.venue = venue;
      return this;
    }

    public Builder contactInfo(ContactInfo contactInfo) {
      this.contactInfo = contactInfo;
      return this;
    }

    public Builder notes(String notes) {
      this.notes = notes;
      return this;
    }

    public Builder interactions(List<Interaction> interactions) {
      this.interactions = new ArrayList<>(interactions);
      return this;
    }

    public Builder reminders(List<Reminder> reminders) {
      this.reminders = new ArrayList<>(reminders);
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

    public Contact build() {
      return new Contact(id, name, role, venue, contactInfo, notes, interactions, reminders,
          createdAt, updatedAt, version);
    }
  }
}
