package ca.gc.cra.subscan.infrastructure.sink;

import ca.gc.cra.subscan.application.port.ResultSinkPort;
import ca.gc.cra.subscan.domain.SubdomainResult;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams results to a JSON file with Jackson's {@link JsonGenerator}:
 * <pre>
 * {"domain":"example.com","subdomains":[{"subdomain":"www.example.com","ips":["..."],"takeover":"..."}]}
 * </pre>
 * Empty {@code ips} and absent {@code takeover} fields are omitted. When more than one domain is scanned the
 * per-domain documents are wrapped in a top-level array.
 *
 * @since 0.1.0
 */
public final class JsonFileResultSink implements ResultSinkPort {
  private static final Logger log = LoggerFactory.getLogger(JsonFileResultSink.class);

  private final Path path;
  private final boolean multiDomain;
  private final JsonGenerator generator;
  private boolean domainOpen;
  private long written;

  /**
   * Opens (truncating) the output file.
   *
   * @param path validated output path
   * @param multiDomain {@code true} to wrap per-domain documents in an array
   * @throws IOException if the file cannot be created
   */
  public JsonFileResultSink(Path path, boolean multiDomain) throws IOException {
    this.path = Objects.requireNonNull(path, "path");
    this.multiDomain = multiDomain;
    this.generator = new JsonFactory().createGenerator(path.toFile(), JsonEncoding.UTF8);
    generator.useDefaultPrettyPrinter();
    if (multiDomain) {
      generator.writeStartArray();
    }
  }

  @Override
  public void beginDomain(String domain) throws IOException {
    if (domainOpen) {
      throw new IllegalStateException("Previous domain was not ended");
    }
    generator.writeStartObject();
    generator.writeStringField("domain", domain);
    generator.writeArrayFieldStart("subdomains");
    domainOpen = true;
  }

  @Override
  public void accept(SubdomainResult result) throws IOException {
    if (!domainOpen) {
      throw new IllegalStateException("accept called outside beginDomain/endDomain");
    }
    generator.writeStartObject();
    generator.writeStringField("subdomain", result.subdomain());
    if (!result.ips().isEmpty()) {
      generator.writeArrayFieldStart("ips");
      for (String ip : result.ips()) {
        generator.writeString(ip);
      }
      generator.writeEndArray();
    }
    if (result.takeover() != null) {
      generator.writeStringField("takeover", result.takeover());
    }
    generator.writeEndObject();
    written++;
  }

  @Override
  public void endDomain(String domain, int discovered) throws IOException {
    if (!domainOpen) {
      return;
    }
    generator.writeEndArray();
    generator.writeEndObject();
    generator.flush();
    domainOpen = false;
  }

  @Override
  public void close() throws IOException {
    try {
      if (domainOpen) {
        endDomain(null, 0);
      }
      if (multiDomain) {
        generator.writeEndArray();
      }
    } finally {
      generator.close();
    }
    log.info("Wrote {} subdomains to {} (JSON)", written, path);
  }
}
