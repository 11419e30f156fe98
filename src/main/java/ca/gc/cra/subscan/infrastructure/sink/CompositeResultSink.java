package ca.gc.cra.subscan.infrastructure.sink;

import ca.gc.cra.subscan.application.port.ResultSinkPort;
import ca.gc.cra.subscan.domain.SubdomainResult;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans every call out to several sinks in order. {@link #close()} closes every sink even when one fails and
 * rethrows the first failure.
 *
 * @since 0.1.0
 */
public final class CompositeResultSink implements ResultSinkPort {
  private static final Logger log = LoggerFactory.getLogger(CompositeResultSink.class);

  private final List<ResultSinkPort> sinks;

  /**
   * Creates a composite.
   *
   * @param sinks delegates, called in list order
   */
  public CompositeResultSink(List<ResultSinkPort> sinks) {
    this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
  }

  @Override
  public void beginDomain(String domain) throws IOException {
    for (ResultSinkPort sink : sinks) {
      sink.beginDomain(domain);
    }
  }

  @Override
  public void accept(SubdomainResult result) throws IOException {
    for (ResultSinkPort sink : sinks) {
      sink.accept(result);
    }
  }

  @Override
  public void endDomain(String domain, int discovered) throws IOException {
    for (ResultSinkPort sink : sinks) {
      sink.endDomain(domain, discovered);
    }
  }

  @Override
  public void close() throws IOException {
    IOException primary = null;
    for (ResultSinkPort sink : sinks) {
      try {
        sink.close();
      } catch (IOException ex) {
        log.error("Failed to close result sink {}", sink.getClass().getSimpleName(), ex);
        if (primary == null) {
          primary = ex;
        } else {
          primary.addSuppressed(ex);
        }
      }
    }
    if (primary != null) {
      throw primary;
    }
  }
}
