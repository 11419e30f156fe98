package ca.gc.cra.subscan.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subscan.application.port.ClockPort;
import ca.gc.cra.subscan.config.CompositionRoot;
import ca.gc.cra.subscan.testutil.StubResolver;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

class PassiveCliTest {
  private static final String CRT_SH_RESPONSE = """
      [{"common_name": "www.example.com", "name_value": "www.example.com\\n*.dev.example.com"},
       {"common_name": "example.com", "name_value": "example.com"}]
      """;

  @TempDir Path tempDir;

  private final StringWriter out = new StringWriter();
  private final StubResolver resolver = new StubResolver();
  private final AtomicInteger status = new AtomicInteger(200);
  private HttpServer server;

  @BeforeEach
  void setUp() throws IOException {
    CliPrinter.setWriterForTesting(new PrintWriter(out, true));
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/", exchange -> {
      byte[] body = CRT_SH_RESPONSE.getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(status.get(), body.length);
      try (OutputStream stream = exchange.getResponseBody()) {
        stream.write(body);
      }
    });
    server.start();
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
    server.stop(0);
  }

  @Test
  void helpPrintsOptions() {
    assertEquals(ExitCode.SUCCESS, run("-h"));
    assertTrue(out.toString().contains("passiveEndpoint=URL"));
  }

  @Test
  void dryRunSendsNoQueries() {
    assertEquals(ExitCode.SUCCESS, run("domain=example.com", "passiveEndpoint=" + endpoint(), "--dry-run"));
    assertTrue(out.toString().contains("Passive dry-run: no queries will be sent."));
  }

  @Test
  void invalidEndpointIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, run("domain=example.com", "passiveEndpoint=ftp://crt.sh/"));
  }

  @Test
  @Timeout(20)
  void enumeratesAndResolves() throws Exception {
    resolver.answer("www.example.com", "192.0.2.80");
    Path json = tempDir.resolve("passive.json");

    ExitCode exit = run(
        "domain=example.com", "passiveEndpoint=" + endpoint(), "jsonOutput=" + json, "--show-ip");

    assertEquals(ExitCode.SUCCESS, exit);
    String printed = out.toString();
    assertTrue(printed.contains(" +  www.example.com (192.0.2.80)"));
    assertTrue(printed.contains(" +  dev.example.com"));
    assertTrue(printed.contains("» Found 2 subdomains"));
    String written = Files.readString(json, StandardCharsets.UTF_8);
    assertTrue(written.contains("\"dev.example.com\""));
    assertEquals(List.of("www.example.com", "dev.example.com"), resolver.queries());
  }

  @Test
  @Timeout(20)
  void sourceFailureIsAnIoError() {
    status.set(502);

    assertEquals(ExitCode.IO_ERROR, run("domain=example.com", "passiveEndpoint=" + endpoint()));
  }

  private String endpoint() {
    return "http://127.0.0.1:" + server.getAddress().getPort() + "/";
  }

  private ExitCode run(String... args) {
    return PassiveCli.run(args, metrics -> new CompositionRoot(metrics, resolver, ClockPort.SYSTEM));
  }
}
