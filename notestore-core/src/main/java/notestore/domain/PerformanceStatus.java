package notestore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PerformanceStatus {
  @JsonProperty("scheduled") SCHEDULED,
  @JsonProperty("in-progress") IN_PROGRESS,
  @JsonProperty("completed") COMPLETED,
  @JsonProperty("cancelled") CANCELLED
}
