package notestore.organize;

import notestore.domain.Contact;
import notestore.domain.Note;
import notestore.domain.SetList;
import notestore.domain.Venue;

import java.time.Instant;
import java.util.List;

/**
 * Portable backup of the user's notes, set lists, venues and contacts.
 *
 * @param exportedAt when the snapshot was taken, written as ISO-8601
 * @param version    snapshot format version, {@value #FORMAT_VERSION} for this release
 */
public record ExportSnapshot(
    List<Note> notes,
    List<SetList> setlists,
    List<Venue> venues,
    List<Contact> contacts,
    Instant exportedAt,
    String version
) {
  public static final String FORMAT_VERSION = "1.0.0";

  public ExportSnapshot {
    notes = notes == null ? List.of() : List.copyOf(notes);
    setlists = setlists == null ? List.of() : List.copyOf(setlists);
    venues = venues == null ? List.of() : List.copyOf(venues);
    contacts = contacts == null ? List.of() : List.copyOf(contacts);
  }
}
