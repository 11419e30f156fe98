package ca.gc.cra.subscan.infrastructure.sink;

import ca.gc.cra.subscan.application.port.ResultSinkPort;
import ca.gc.cra.subscan.domain.SubdomainResult;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams one hostname per line to a text file as results arrive.
 *
 * @since 0.1.0
 */
public final class TextFileResultSink implements ResultSinkPort {
  private static final Logger log = LoggerFactory.getLogger(TextFileResultSink.class);

  private final Path path;
  private final BufferedWriter writer;
  private long written;

  /**
   * Opens (truncating) the output file.
   *
   * @param path validated output path
   * @throws IOException if the file cannot be created
   */
  public TextFileResultSink(Path path) throws IOException {
    this.path = Objects.requireNonNull(path, "path");
    this.writer = Files.newBufferedWriter(
        path,
        StandardCharsets.UTF_8,
        StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING,
        StandardOpenOption.WRITE);
  }

  @Override
  public void accept(SubdomainResult result) throws IOException {
    writer.write(result.subdomain());
    writer.newLine();
    written++;
  }

  @Override
  public void endDomain(String domain, int discovered) throws IOException {
    writer.flush();
  }

  @Override
  public void close() throws IOException {
    writer.close();
    log.info("Wrote {} subdomains to {} (text)", written, path);
  }
}
