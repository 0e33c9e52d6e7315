package notestore.organize;

import java.util.List;

/**
 * Collections that can be exported as CSV, each with a fixed column order.
 */
public enum CsvExportType {
  NOTES(List.of("ID", "Content", "Capture Method", "Tags", "Venue", "Audience",
      "Estimated Duration", "Created At", "Updated At")),
  SETLISTS(List.of("ID", "Name", "Total Duration", "Note Count", "Venue", "Performance Date",
      "Created At")),
  VENUES(List.of("ID", "Name", "Location", "Audience Size", "Audience Type", "Acoustics",
      "Lighting", "Created At")),
  CONTACTS(List.of("ID", "Name", "Role", "Venue", "Email", "Phone", "Created At"));

  private final List<String> headers;

  CsvExportType(List<String> headers) {
    this.headers = headers;
  }

  public List<String> headers() {
    return headers;
  }
}
