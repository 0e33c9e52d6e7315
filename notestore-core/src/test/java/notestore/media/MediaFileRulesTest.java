package notestore.media;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MediaFileRulesTest {

  @Test
  void acceptsAllowedAudio() {
    MediaFileRules.Result result = MediaFileRules.AUDIO.validate(1024, "audio/webm");

    assertTrue(result.valid());
    assertNull(result.error());
  }

  @Test
  void rejectsOversizedImage() {
    MediaFileRules.Result result = MediaFileRules.IMAGE.validate(11L * 1024 * 1024, "image/png");

    assertFalse(result.valid());
    assertEquals("File size exceeds 10 MB limit", result.error());
  }

  @Test
  void rejectsUnlistedType() {
    MediaFileRules.Result result = MediaFileRules.IMAGE.validate(10, "image/gif");

    assertFalse(result.valid());
    assertEquals("File type image/gif not allowed", result.error());
  }

  @Test
  void emptyAllowListAcceptsAnyType() {
    MediaFileRules rules = new MediaFileRules(100, Set.of());

    assertTrue(rules.validate(50, "application/pdf").valid());
  }

  @Test
  void formatsFileSizes() {
    assertEquals("0 Bytes", MediaFileRules.formatFileSize(0));
    assertEquals("512 Bytes", MediaFileRules.formatFileSize(512));
    assertEquals("1.5 KB", MediaFileRules.formatFileSize(1536));
    assertEquals("50 MB", MediaFileRules.formatFileSize(50L * 1024 * 1024));
  }
}
