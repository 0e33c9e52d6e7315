package notestore.service;

import notestore.domain.Note;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SetListServiceTest {

  @Test
  void totalDurationSumsDeclaredDurations() {
    assertEquals(75.0, SetListService.totalDuration(List.of(note(30), note(45))), 1e-9);
  }

  @Test
  void notesWithoutDurationCountAsZero() {
    Note undated = Note.builder().content("tag").createdAt(Instant.EPOCH).updatedAt(Instant.EPOCH).build();

    assertEquals(30.0, SetListService.totalDuration(List.of(note(30), undated)), 1e-9);
    assertEquals(0.0, SetListService.totalDuration(List.of()), 1e-9);
  }

  private static Note note(double seconds) {
    return Note.builder()
        .content("bit " + seconds)
        .duration(seconds)
        .createdAt(Instant.EPOCH)
        .updatedAt(Instant.EPOCH)
        .build();
  }
}
