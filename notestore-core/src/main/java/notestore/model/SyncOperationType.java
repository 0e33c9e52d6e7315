package notestore.model;

import java.util.Arrays;

public enum SyncOperationType {
  CREATE("create"),
  UPDATE("update"),
  DELETE("delete");

  private final String code;

  SyncOperationType(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  public static SyncOperationType fromCode(String code) {
    return Arrays.stream(values())
        .filter(t -> t.code.equals(code))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown sync operation type: " + code));
  }
}
