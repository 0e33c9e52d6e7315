package notestore;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ListOptionsTest {

  @Test
  void defaultsSortNewestFirstWithoutLimit() {
    ListOptions options = ListOptions.defaults();

    assertEquals("createdAt", options.sortBy());
    assertEquals(SortOrder.DESC, options.order());
    assertEquals(0, options.offset());
    assertNull(options.limit());
    assertTrue(options.filters().isEmpty());
  }

  @Test
  void toBuilderKeepsSettings() {
    ListOptions options = ListOptions.builder()
        .filter("venue", "Cellar")
        .sortBy("name", SortOrder.ASC)
        .offset(5)
        .limit(10)
        .build();

    ListOptions copy = options.toBuilder().limit(3).build();

    assertEquals("Cellar", copy.filters().get("venue"));
    assertEquals("name", copy.sortBy());
    assertEquals(5, copy.offset());
    assertEquals(3, copy.limit());
  }

  @Test
  void negativePagingIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ListOptions.builder().offset(-1));
    assertThrows(IllegalArgumentException.class, () -> ListOptions.builder().limit(-1));
  }
}
