package ca.gc.cra.subscan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subscan.application.port.ClockPort;
import ca.gc.cra.subscan.application.port.ResultSinkPort;
import ca.gc.cra.subscan.application.scan.ScanReport;
import ca.gc.cra.subscan.domain.SubdomainResult;
import ca.gc.cra.subscan.infrastructure.sink.CompositeResultSink;
import ca.gc.cra.subscan.infrastructure.sink.ConsoleResultSink;
import ca.gc.cra.subscan.testutil.RecordingMetricsPort;
import ca.gc.cra.subscan.testutil.RecordingResultSink;
import ca.gc.cra.subscan.testutil.StubResolver;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  private final StubResolver resolver = new StubResolver();
  private final CompositionRoot root = new CompositionRoot(new RecordingMetricsPort(), resolver, ClockPort.SYSTEM);

  @Test
  void resolvesSingleDomainOrList() throws Exception {
    Path list = tempDir.resolve("domains.txt");
    Files.writeString(list, "example.com\nexample.org\n", StandardCharsets.UTF_8);

    assertEquals(List.of("example.com"), CompositionRoot.resolveDomains(Optional.of("example.com"), Optional.empty()));
    assertEquals(
        List.of("example.com", "example.org"), CompositionRoot.resolveDomains(Optional.empty(), Optional.of(list)));
  }

  @Test
  void consoleOnlySinkIsNotWrapped() throws Exception {
    ResultSinkPort sink = root.resultSink(
        new PrintWriter(new StringWriter()), false, Optional.empty(), Optional.empty(), false);

    assertInstanceOf(ConsoleResultSink.class, sink);
  }

  @Test
  void fileOutputsAreCombinedWithConsole() throws Exception {
    StringWriter console = new StringWriter();
    Path text = tempDir.resolve("out.txt");
    Path json = tempDir.resolve("out.json");

    try (ResultSinkPort sink =
        root.resultSink(new PrintWriter(console), false, Optional.of(text), Optional.of(json), false)) {
      assertInstanceOf(CompositeResultSink.class, sink);
      sink.beginDomain("example.com");
      sink.accept(SubdomainResult.of("www.example.com"));
      sink.endDomain("example.com", 1);
    }

    assertEquals(List.of("www.example.com"), Files.readAllLines(text, StandardCharsets.UTF_8));
    assertTrue(Files.readString(json, StandardCharsets.UTF_8).contains("\"www.example.com\""));
    assertTrue(console.toString().contains("www.example.com"));
  }

  @Test
  @Timeout(10)
  void wiresActiveScanFromConfig() throws Exception {
    Path words = tempDir.resolve("words.txt");
    Files.writeString(words, "www\napi\n", StandardCharsets.UTF_8);
    resolver.answer("api.example.com", "192.0.2.5");
    ScanConfig config = ScanConfig.fromMap(Map.of(
        "domain", "example.com",
        "wordlist", words.toString(),
        "rateLimit", "1",
        "workers", "2",
        "showIp", "true"));
    RecordingResultSink sink = new RecordingResultSink();

    List<ScanReport> reports = root.activeScanUseCase(config, List.of("example.com"), List.of(), sink).run();

    assertEquals(1, reports.size());
    assertEquals(List.of("api.example.com"), sink.subdomains());
    assertEquals(List.of("192.0.2.5"), sink.results().get(0).ips());
    assertTrue(sink.closed());
  }
}
