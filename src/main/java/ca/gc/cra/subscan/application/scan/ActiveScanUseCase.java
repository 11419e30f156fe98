package ca.gc.cra.subscan.application.scan;

import ca.gc.cra.subscan.application.port.MetricsPort;
import ca.gc.cra.subscan.application.port.ResolutionCache;
import ca.gc.cra.subscan.application.port.ResolverPort;
import ca.gc.cra.subscan.application.port.ResultSinkPort;
import ca.gc.cra.subscan.application.port.WordSource;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs an active brute-force scan for each requested root domain.
 * <p>For every domain the use case sizes the word source, picks eager or streamed ingestion, builds a fresh
 * resolution cache and rate controller, and drives a {@link ScanOrchestrator}. The result sink is shared across
 * domains and closed once the last domain finishes. Instances are not reusable; invoke {@link #run()} at most
 * once.</p>
 *
 * @since 0.1.0
 */
public final class ActiveScanUseCase {
  private static final Logger log = LoggerFactory.getLogger(ActiveScanUseCase.class);

  private final List<String> domains;
  private final WordSource words;
  private final ResolverPort resolver;
  private final List<String> resolvers;
  private final Function<OptionalLong, ResolutionCache> cacheFactory;
  private final TakeoverDetector takeoverDetector;
  private final ResultSinkPort sink;
  private final MetricsPort metrics;
  private final Settings settings;

  /**
   * Creates the use case.
   *
   * @param domains cleaned root domains, scanned in order
   * @param words candidate word source, reopened for every domain and closed by {@link #run()}
   * @param resolver DNS resolver port
   * @param resolvers resolver addresses tried in order; empty for the default resolver
   * @param cacheFactory builds a cache for the expected word count (empty when unknown)
   * @param takeoverDetector detector, or {@code null} when takeover checks are off
   * @param sink destination for results; closed by {@link #run()}
   * @param metrics metrics sink
   * @param settings scan tuning
   */
  public ActiveScanUseCase(
      List<String> domains,
      WordSource words,
      ResolverPort resolver,
      List<String> resolvers,
      Function<OptionalLong, ResolutionCache> cacheFactory,
      TakeoverDetector takeoverDetector,
      ResultSinkPort sink,
      MetricsPort metrics,
      Settings settings) {
    this.domains = List.copyOf(Objects.requireNonNull(domains, "domains"));
    if (this.domains.isEmpty()) {
      throw new IllegalArgumentException("at least one domain is required");
    }
    this.words = Objects.requireNonNull(words, "words");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.resolvers = List.copyOf(Objects.requireNonNull(resolvers, "resolvers"));
    this.cacheFactory = Objects.requireNonNull(cacheFactory, "cacheFactory");
    this.takeoverDetector = takeoverDetector;
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Scans every domain in order.
   *
   * @return one report per domain
   * @throws IOException if the word source or a sink fails
   * @throws InterruptedException if the calling thread is interrupted
   */
  public List<ScanReport> run() throws IOException, InterruptedException {
    MDC.put("pipeline", "active");
    List<ScanReport> reports = new ArrayList<>(domains.size());
    Exception primaryFailure = null;
    try {
      OptionalLong size = words.knownSize();
      boolean streamed = settings.forceStream()
          || size.isEmpty()
          || size.getAsLong() > CacheSettings.STREAMING_THRESHOLD;
      log.info(
          "Active scan of {} domain(s) using {} ({} words, {} ingestion)",
          domains.size(),
          words.describe(),
          size.isPresent() ? Long.toString(size.getAsLong()) : "unknown",
          streamed ? "streamed" : "eager");
      for (String domain : domains) {
        reports.add(scanDomain(domain, size, streamed));
      }
    } catch (IOException | InterruptedException | RuntimeException failure) {
      primaryFailure = failure;
      throw failure;
    } finally {
      try {
        closeAfterRun(words, "word source", primaryFailure);
      } finally {
        try {
          closeAfterRun(sink, "result sink", primaryFailure);
        } finally {
          MDC.remove("pipeline");
        }
      }
    }
    return reports;
  }

  private static void closeAfterRun(AutoCloseable resource, String name, Exception primaryFailure)
      throws IOException {
    try {
      resource.close();
    } catch (Exception closeFailure) {
      log.error("Failed to close {}", name, closeFailure);
      if (primaryFailure != null) {
        primaryFailure.addSuppressed(closeFailure);
        return;
      }
      if (closeFailure instanceof IOException io) {
        throw io;
      }
      throw new IOException("Failed to close " + name, closeFailure);
    }
  }

  private ScanReport scanDomain(String domain, OptionalLong size, boolean streamed)
      throws IOException, InterruptedException {
    ResolutionCache cache = cacheFactory.apply(size);
    try {
      ScanOrchestrator orchestrator =
          new ScanOrchestrator(
              domain,
              words,
              resolver,
              resolvers,
              cache,
              new RateController(settings.backoff()),
              takeoverDetector,
              sink,
              metrics,
              new ScanOrchestrator.Settings(
                  settings.workers(), settings.recursive(), settings.depth(), settings.showIp(), streamed));
      sink.beginDomain(domain);
      ScanReport report = orchestrator.run();
      sink.endDomain(domain, report.results().size());
      log.info(
          "Scan of {} finished: {} level(s), {} candidates, {} found, {} cache hits, {} failed lookups",
          domain,
          report.levels(),
          report.totalCandidates(),
          report.results().size(),
          report.cacheHits(),
          report.resolutionFailures());
      return report;
    } finally {
      cache.close();
    }
  }

  /**
   * Active scan tuning.
   *
   * @param workers worker threads per level
   * @param recursive whether discoveries are expanded again
   * @param depth last level to scan, or {@link ScanOrchestrator.Settings#UNLIMITED_DEPTH}
   * @param showIp whether results carry resolved addresses
   * @param forceStream stream words even when the source is small
   * @param backoff per-root-host backoff tuning
   */
  public record Settings(
      int workers, boolean recursive, int depth, boolean showIp, boolean forceStream, BackoffSettings backoff) {
    public Settings {
      Objects.requireNonNull(backoff, "backoff");
    }

    /**
     * Convenience factory deriving backoff defaults from the rate limit.
     *
     * @param workers worker threads per level
     * @param recursive whether discoveries are expanded again
     * @param depth last level to scan
     * @param showIp whether results carry resolved addresses
     * @param forceStream stream words even when the source is small
     * @param rateLimit base delay between requests to one root host
     * @return settings
     */
    public static Settings of(
        int workers, boolean recursive, int depth, boolean showIp, boolean forceStream, Duration rateLimit) {
      return new Settings(
          workers, recursive, depth, showIp, forceStream, BackoffSettings.forRateLimit(rateLimit));
    }
  }
}
