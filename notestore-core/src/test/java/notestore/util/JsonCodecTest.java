package notestore.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import notestore.ValidationException;
import notestore.domain.CaptureMethod;
import notestore.domain.Note;
import notestore.domain.PerformanceStatus;
import notestore.domain.RehearsalSession;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JsonCodecTest {

  private static final Instant NOW = Instant.parse("2024-05-01T20:00:00Z");
  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void instantsAreIsoStringsAndNullsAreOmitted() {
    Note note = Note.builder()
        .id(UUID.randomUUID().toString())
        .content("Opener")
        .captureMethod(CaptureMethod.VOICE)
        .createdAt(NOW)
        .updatedAt(NOW)
        .build();

    ObjectNode json = codec.toObject(note);

    assertEquals("2024-05-01T20:00:00Z", json.get("createdAt").asText());
    assertEquals("voice", json.get("captureMethod").asText());
    assertFalse(json.has("venue"));
    assertTrue(json.get("tags").isArray());
  }

  @Test
  void enumsUseWireNames() {
    assertEquals("in-progress", codec.toTree(PerformanceStatus.IN_PROGRESS).asText());
  }

  @Test
  void completedFlagUsesIsCompletedName() {
    RehearsalSession session = RehearsalSession.builder()
        .id(UUID.randomUUID().toString())
        .setListId(UUID.randomUUID().toString())
        .startTime(NOW)
        .completed(true)
        .createdAt(NOW)
        .updatedAt(NOW)
        .build();

    JsonNode json = codec.toTree(session);

    assertTrue(json.get("isCompleted").asBoolean());
    assertTrue(codec.fromTree(json, RehearsalSession.class).completed());
  }

  @Test
  void unknownPropertiesAreIgnored() {
    Note note = codec.read("{\"content\":\"Bit\",\"captureMethod\":\"text\",\"legacyFlag\":true}", Note.class);

    assertEquals("Bit", note.content());
    assertTrue(note.tags().isEmpty());
  }

  @Test
  void badEnumValueBecomesValidationExceptionWithPath() {
    ValidationException e = assertThrows(ValidationException.class,
        () -> codec.read("{\"content\":\"Bit\",\"captureMethod\":\"mixed\"}", Note.class));

    assertEquals("captureMethod", e.violations().get(0).path());
  }

  @Test
  void malformedJsonBecomesValidationException() {
    assertThrows(ValidationException.class, () -> codec.parse("{\"content\":"));
  }

  @Test
  void toObjectRejectsScalars() {
    assertThrows(IllegalArgumentException.class, () -> codec.toObject("text"));
  }
}
