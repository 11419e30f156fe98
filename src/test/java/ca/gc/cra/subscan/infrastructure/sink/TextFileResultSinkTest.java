package ca.gc.cra.subscan.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.subscan.domain.SubdomainResult;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TextFileResultSinkTest {
  @TempDir Path tempDir;

  @Test
  void writesOneHostnamePerLineAcrossDomains() throws Exception {
    Path file = tempDir.resolve("out.txt");
    try (TextFileResultSink sink = new TextFileResultSink(file)) {
      sink.beginDomain("example.com");
      sink.accept(SubdomainResult.of("www.example.com").withIps(List.of("192.0.2.1")));
      sink.endDomain("example.com", 1);
      sink.beginDomain("example.org");
      sink.accept(SubdomainResult.of("api.example.org").withTakeover("heroku"));
      sink.endDomain("example.org", 1);
    }

    assertEquals(List.of("www.example.com", "api.example.org"), Files.readAllLines(file, StandardCharsets.UTF_8));
  }

  @Test
  void truncatesExistingFile() throws Exception {
    Path file = tempDir.resolve("out.txt");
    Files.writeString(file, "stale.example.com\nolder.example.com\n", StandardCharsets.UTF_8);

    try (TextFileResultSink sink = new TextFileResultSink(file)) {
      sink.accept(SubdomainResult.of("fresh.example.com"));
    }

    assertEquals(List.of("fresh.example.com"), Files.readAllLines(file, StandardCharsets.UTF_8));
  }
}
