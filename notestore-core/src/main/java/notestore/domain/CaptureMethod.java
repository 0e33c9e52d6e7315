package notestore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How a note was captured.
 */
public enum CaptureMethod {
  @JsonProperty("text") TEXT,
  @JsonProperty("voice") VOICE,
  @JsonProperty("image") IMAGE
}
