package ca.gc.cra.subscan.infrastructure.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subscan.application.port.WordlistLoadException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileWordSourceTest {
  @TempDir Path tempDir;

  @Test
  void streamsTrimmedNonCommentLines() throws Exception {
    Path file = tempDir.resolve("words.txt");
    Files.writeString(file, "www\n  api  \n\n# staging hosts\nmail\r\n", StandardCharsets.UTF_8);
    FileWordSource source = new FileWordSource(file);

    try (Stream<String> words = source.stream()) {
      assertEquals(List.of("www", "api", "mail"), words.toList());
    }
    assertEquals(OptionalLong.of(3), source.knownSize());
    assertEquals(List.of("www", "api", "mail"), source.readAll());
  }

  @Test
  void streamCanBeReopened() throws Exception {
    Path file = tempDir.resolve("words.txt");
    Files.writeString(file, "a\nb\n", StandardCharsets.UTF_8);
    FileWordSource source = new FileWordSource(file);

    assertEquals(source.readAll(), source.readAll());
  }

  @Test
  void missingFileIsReported() {
    Path missing = tempDir.resolve("absent.txt");
    FileWordSource source = new FileWordSource(missing);

    WordlistLoadException thrown = assertThrows(WordlistLoadException.class, source::stream);
    assertTrue(thrown.getMessage().startsWith("Wordlist file not found"));
    assertEquals(missing.toString(), source.describe());
  }
}
