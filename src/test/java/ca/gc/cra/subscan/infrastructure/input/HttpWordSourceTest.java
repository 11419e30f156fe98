package ca.gc.cra.subscan.infrastructure.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subscan.application.port.WordlistLoadException;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpWordSourceTest {
  private HttpServer server;
  private final AtomicInteger downloads = new AtomicInteger();

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
    server.createContext("/words.txt", exchange -> {
      downloads.incrementAndGet();
      byte[] body = "www\n# comment\napi\n".getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(200, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    });
    server.createContext("/missing.txt", exchange -> {
      exchange.sendResponseHeaders(404, -1);
      exchange.close();
    });
    server.start();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  @Test
  void downloadsOnceAndRereadsFromSpool() throws Exception {
    HttpWordSource source = new HttpWordSource(uri("/words.txt"));

    assertEquals(List.of("www", "api"), source.readAll());
    assertEquals(List.of("www", "api"), source.readAll());
    assertEquals(1, downloads.get());
    assertEquals(OptionalLong.empty(), source.knownSize());
  }

  @Test
  void closeDeletesTheSpooledCopy() throws Exception {
    HttpWordSource source = new HttpWordSource(uri("/words.txt"));
    source.readAll();
    Path spool = source.spoolFile().orElseThrow();
    assertTrue(Files.exists(spool));

    source.close();

    assertFalse(Files.exists(spool));
    assertEquals(Optional.empty(), source.spoolFile());
    assertThrows(WordlistLoadException.class, source::readAll);
  }

  @Test
  void nonOkStatusFailsTheLoad() {
    HttpWordSource source = new HttpWordSource(uri("/missing.txt"));

    WordlistLoadException thrown = assertThrows(WordlistLoadException.class, source::readAll);
    assertTrue(thrown.getMessage().contains("HTTP 404"), thrown.getMessage());
  }

  private URI uri(String path) {
    return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
  }
}
