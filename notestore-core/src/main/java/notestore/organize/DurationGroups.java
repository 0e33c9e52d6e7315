package notestore.organize;

import notestore.domain.Note;

import java.util.List;

/**
 * Notes bucketed by {@link DurationCategory}.
 */
public record DurationGroups(List<Note> shortNotes, List<Note> mediumNotes, List<Note> longNotes) {}
