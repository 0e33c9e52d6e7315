package notestore.organize;

public enum DurationCategory {
  SHORT,
  MEDIUM,
  LONG
}
