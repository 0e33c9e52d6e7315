package notestore.domain;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import notestore.Entity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A captured piece of material: text, transcribed voice memo or photographed page.
 */
public record Note(
    @NotNull @Pattern(regexp = Constraints.UUID) String id,
    @NotEmpty @Size(max = 10_000) String content,
    @NotNull CaptureMethod captureMethod,
    @Size(max = 20) List<@NotBlank @Size(max = 50) String> tags,
    @Size(max = 200) String venue,
    @Size(max = 100) String audience,
    @DecimalMin("0") @DecimalMax("7200") Double estimatedDuration,
    @Valid NoteMetadata metadata,
    @Size(max = 10) List<@Valid Attachment> attachments,
    @NotNull Instant createdAt,
    @NotNull Instant updatedAt,
    @Min(1) Integer version
) implements Entity {

  public Note {
    tags = Constraints.list(tags);
    attachments = Constraints.list(attachments);
  }

  /**
   * Declared duration from the capture metadata, or 0 when none was recorded.
   */
  public double declaredDuration() {
    return metadata == null || metadata.duration() == null ? 0 : metadata.duration();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .id(id).content(content).captureMethod(captureMethod).tags(tags).venue(venue)
        .audience(audience).estimatedDuration(estimatedDuration).metadata(metadata)
        .attachments(attachments).createdAt(createdAt).updatedAt(updatedAt).version(version);
  }

  public static final class Builder {
    private String id;
    private String content;
    private CaptureMethod captureMethod = CaptureMethod.TEXT;
    private List<String> tags = new ArrayList<>();
    private String venue;
    private String audience;
    private Double estimatedDuration;
    private NoteMetadata metadata;
    private List<Attachment> attachments = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;
    private Integer version;

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder content(String content) {
      this.content = content;
      return this;
    }

    public Builder captureMethod(CaptureMethod captureMethod) {
      this.captureMethod = captureMethod;
      return this;
    }

    public Builder tags(List<String> tags) {
      this.tags = new ArrayList<>(tags);
      return this;
    }

    public Builder tag(String tag) {
      this.tags.add(tag);
      return this;
    }

    public Builder venue(String venue) {
      this.venue = venue;
      return this;
    }

    public Builder audience(String audience) {
      this.audience = audience;
      return this;
    }

    public Builder estimatedDuration(Double estimatedDuration) {
      this.estimatedDuration = estimatedDuration;
      return this;
    }

    public Builder metadata(NoteMetadata metadata) {
      this.metadata = metadata;
      return this;
    }

    /**
     * Shorthand for metadata carrying only a declared duration.
     */
    public Builder duration(double seconds) {
      this.metadata = NoteMetadata.ofDuration(seconds);
      return this;
    }

    public Builder attachments(List<Attachment> attachments) {
      this.attachments = new ArrayList<>(attachments);
      return this;
    }

    public Builder attachment(Attachment attachment) {
      this.attachments.add(attachment);
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

    public Note build() {
      return new Note(id, content, captureMethod, tags, venue, audience, estimatedDuration,
          metadata, attachments, createdAt, updatedAt, version);
    }
  }
}
