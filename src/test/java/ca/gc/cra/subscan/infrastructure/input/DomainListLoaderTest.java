package ca.gc.cra.subscan.infrastructure.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DomainListLoaderTest {
  @TempDir Path tempDir;

  @Test
  void cleansDeduplicatesAndSkipsInvalidEntries() throws IOException {
    Path file = tempDir.resolve("domains.txt");
    Files.writeString(file, String.join("\n",
        "https://www.Example.com",
        "example.com",
        "# internal",
        "not a domain",
        "localhost",
        "example.org",
        ""), StandardCharsets.UTF_8);

    assertEquals(List.of("example.com", "example.org"), DomainListLoader.load(file));
  }

  @Test
  void missingFilePropagatesIoException() {
    assertThrows(IOException.class, () -> DomainListLoader.load(tempDir.resolve("absent.txt")));
  }
}
