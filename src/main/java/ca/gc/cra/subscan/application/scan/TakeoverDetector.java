package ca.gc.cra.subscan.application.scan;

import ca.gc.cra.subscan.application.port.HttpProbePort;
import ca.gc.cra.subscan.application.port.MetricsPort;
import ca.gc.cra.subscan.domain.SubdomainResult;
import ca.gc.cra.subscan.domain.TakeoverFingerprint;
import ca.gc.cra.subscan.domain.TakeoverFingerprints;
import ca.gc.cra.subscan.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Probes a discovered host over plain HTTP and flags it when the response body carries a known
 * deprovisioned-service fingerprint.
 *
 * <p>Fingerprints are tested in list order and the first match wins. Transport failures mean "not
 * vulnerable" and are only logged at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class TakeoverDetector {
  private static final Logger log = LoggerFactory.getLogger(TakeoverDetector.class);
  private static final int LOG_BODY_BYTES = 256;

  private final HttpProbePort probe;
  private final List<TakeoverFingerprint> fingerprints;
  private final MetricsPort metrics;

  /**
   * Creates a detector using {@link TakeoverFingerprints#DEFAULT}.
   *
   * @param probe HTTP client port
   * @param metrics metrics sink
   */
  public TakeoverDetector(HttpProbePort probe, MetricsPort metrics) {
    this(probe, TakeoverFingerprints.DEFAULT, metrics);
  }

  /**
   * Creates a detector with an explicit fingerprint list.
   *
   * @param probe HTTP client port
   * @param fingerprints ordered fingerprints; earlier entries take priority
   * @param metrics metrics sink
   */
  public TakeoverDetector(HttpProbePort probe, List<TakeoverFingerprint> fingerprints, MetricsPort metrics) {
    this.probe = Objects.requireNonNull(probe, "probe");
    this.fingerprints = List.copyOf(Objects.requireNonNull(fingerprints, "fingerprints"));
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Checks one result.
   *
   * @param result discovered host
   * @return the same result, or a copy carrying the matched service id
   * @throws InterruptedException if the calling worker is interrupted during the probe
   */
  public SubdomainResult check(SubdomainResult result) throws InterruptedException {
    Objects.requireNonNull(result, "result");
    String body;
    try {
      body = probe.get(URI.create("http://" + result.subdomain()));
    } catch (IOException | IllegalArgumentException ex) {
      log.debug("Takeover probe for {} failed: {}", result.subdomain(), Logs.rootCause(ex));
      return result;
    }
    Optional<TakeoverFingerprint> match = TakeoverFingerprints.firstMatch(fingerprints, body);
    if (match.isEmpty()) {
      return result;
    }
    String service = match.get().service();
    metrics.increment("scan.takeover.detected");
    if (log.isDebugEnabled()) {
      log.debug("{} matched takeover fingerprint {}: {}",
          result.subdomain(), service, Logs.truncate(body, LOG_BODY_BYTES));
    }
    return result.withTakeover(service);
  }
}
