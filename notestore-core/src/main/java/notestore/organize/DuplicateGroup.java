package notestore.organize;

import notestore.domain.Note;

import java.util.List;

/**
 * A note and the later notes that resemble it.
 */
public record DuplicateGroup(Note original, List<Match> duplicates) {

  public DuplicateGroup {
    duplicates = List.copyOf(duplicates);
  }

  public record Match(Note note, double similarity, List<String> reasons) {}
}
