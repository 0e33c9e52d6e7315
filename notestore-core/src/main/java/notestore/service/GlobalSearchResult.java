package notestore.service;

import notestore.domain.Contact;
import notestore.domain.Note;
import notestore.domain.Performance;
import notestore.domain.SetList;
import notestore.domain.Venue;

import java.util.List;

/**
 * Matches of one global search, grouped by collection. No ranking across collections.
 */
public record GlobalSearchResult(
    List<Note> notes,
    List<SetList> setlists,
    List<Venue> venues,
    List<Contact> contacts,
    List<Performance> performances
) {

  public int total() {
    return notes.size() + setlists.size() + venues.size() + contacts.size() + performances.size();
  }
}
