package notestore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Media attached to a note. The bytes live in the blob store under {@code blobKey}.
 */
public record Attachment(
    @NotNull @Pattern(regexp = Constraints.UUID) String id,
    @NotNull Type type,
    @Size(max = 255) String filename,
    @Size(max = 100) String mimeType,
    @Min(0) Long size,
    @NotBlank String blobKey
) {

  public enum Type {
    @JsonProperty("audio") AUDIO,
    @JsonProperty("image") IMAGE
  }
}
