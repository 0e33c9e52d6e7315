package notestore.organize;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvWriterTest {

  @Test
  void plainFieldsAreNotQuoted() {
    String csv = new CsvWriter().row(List.of("ID", "Name")).row(List.of("1", "Cellar")).toString();

    assertEquals("ID,Name\n1,Cellar", csv);
  }

  @Test
  void specialCharactersAreQuotedAndQuotesDoubled() {
    assertEquals("\"a,b\"", CsvWriter.escape("a,b"));
    assertEquals("\"say \"\"hi\"\"\"", CsvWriter.escape("say \"hi\""));
    assertEquals("\"line\nbreak\"", CsvWriter.escape("line\nbreak"));
  }

  @Test
  void valuesAreFormatted() {
    assertEquals("", CsvWriter.format(null));
    assertEquals("2024-05-01T20:00:00Z", CsvWriter.format(Instant.parse("2024-05-01T20:00:00Z")));
    assertEquals("75", CsvWriter.format(75.0));
    assertEquals("12.5", CsvWriter.format(12.5));
    assertEquals("3", CsvWriter.format(3));
  }

  @Test
  void nullFieldsBecomeEmpty() {
    String csv = new CsvWriter().row(Arrays.asList("a", null, "c")).toString();

    assertEquals("a,,c", csv);
  }
}
