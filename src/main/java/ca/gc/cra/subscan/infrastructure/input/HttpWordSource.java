package ca.gc.cra.subscan.infrastructure.input;

import ca.gc.cra.subscan.application.port.WordSource;
import ca.gc.cra.subscan.application.port.WordlistLoadException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Word source backed by a remote text resource. The body is downloaded once to a temporary file on the first
 * {@link #stream()} and every pass then reads that file lazily, so recursion levels do not refetch it.
 * {@link #close()} deletes the temporary file.
 *
 * @since 0.1.0
 */
public final class HttpWordSource implements WordSource {
  private static final Logger log = LoggerFactory.getLogger(HttpWordSource.class);
  private static final Duration TIMEOUT = Duration.ofSeconds(60);

  private final URI uri;
  private final HttpClient client;
  private FileWordSource spooled;
  private Path spoolFile;
  private boolean closed;

  /**
   * Creates a source for {@code uri}; nothing is fetched until {@link #stream()}.
   *
   * @param uri {@code http} or {@code https} location
   */
  public HttpWordSource(URI uri) {
    this.uri = Objects.requireNonNull(uri, "uri");
    this.client = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(TIMEOUT)
        .build();
  }

  @Override
  public Stream<String> stream() throws WordlistLoadException {
    return download().stream();
  }

  @Override
  public String describe() {
    return uri.toString();
  }

  @Override
  public synchronized void close() throws IOException {
    closed = true;
    spooled = null;
    if (spoolFile != null) {
      Files.deleteIfExists(spoolFile);
      log.debug("Deleted temporary wordlist {}", spoolFile);
      spoolFile = null;
    }
  }

  synchronized Optional<Path> spoolFile() {
    return Optional.ofNullable(spoolFile);
  }

  private synchronized FileWordSource download() throws WordlistLoadException {
    if (closed) {
      throw new WordlistLoadException("Wordlist source " + uri + " is closed");
    }
    if (spooled != null) {
      return spooled;
    }
    log.info("Downloading wordlist from {}", uri);
    Path target = null;
    try {
      target = Files.createTempFile("subscan-wordlist-", ".txt");
      target.toFile().deleteOnExit();
      HttpRequest request = HttpRequest.newBuilder(uri).GET().timeout(TIMEOUT).build();
      HttpResponse<Path> response = client.send(request, HttpResponse.BodyHandlers.ofFile(target));
      if (response.statusCode() != 200) {
        throw new WordlistLoadException("Wordlist download from " + uri + " returned HTTP " + response.statusCode());
      }
      log.debug("Wordlist spooled to {} ({} bytes)", target, Files.size(target));
      spoolFile = target;
      spooled = new FileWordSource(target);
      return spooled;
    } catch (WordlistLoadException ex) {
      deleteQuietly(target);
      throw ex;
    } catch (IOException ex) {
      deleteQuietly(target);
      throw new WordlistLoadException("Failed to fetch wordlist " + uri, ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      deleteQuietly(target);
      throw new WordlistLoadException("Interrupted while fetching wordlist " + uri, ex);
    }
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException ex) {
      log.debug("Could not delete temporary wordlist {}", path, ex);
    }
  }
}
