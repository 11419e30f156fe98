package ca.gc.cra.subscan.config;

import ca.gc.cra.subscan.application.port.ClockPort;
import ca.gc.cra.subscan.application.port.MetricsPort;
import ca.gc.cra.subscan.application.port.PassiveEnumerationPort;
import ca.gc.cra.subscan.application.port.ResolverPort;
import ca.gc.cra.subscan.application.port.ResultSinkPort;
import ca.gc.cra.subscan.application.scan.ActiveScanUseCase;
import ca.gc.cra.subscan.application.scan.PassiveScanUseCase;
import ca.gc.cra.subscan.application.scan.TakeoverDetector;
import ca.gc.cra.subscan.infrastructure.cache.ResolutionCaches;
import ca.gc.cra.subscan.infrastructure.dns.DnsResolverAdapter;
import ca.gc.cra.subscan.infrastructure.http.JdkHttpProbeAdapter;
import ca.gc.cra.subscan.infrastructure.input.DomainListLoader;
import ca.gc.cra.subscan.infrastructure.input.WordSources;
import ca.gc.cra.subscan.infrastructure.passive.CrtShPassiveEnumerationAdapter;
import ca.gc.cra.subscan.infrastructure.sink.CompositeResultSink;
import ca.gc.cra.subscan.infrastructure.sink.ConsoleResultSink;
import ca.gc.cra.subscan.infrastructure.sink.JsonFileResultSink;
import ca.gc.cra.subscan.infrastructure.sink.TextFileResultSink;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires SubScan use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps adapter construction out of the CLI and the scan engine, so tests can swap in
 * stubs at the port seams.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve target domains from a single option or a list file.</li>
 *   <li>Build the result sink chain (console plus optional text and JSON files).</li>
 *   <li>Construct active and passive use cases with DNS, HTTP, cache, and metrics adapters.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Factory methods create new adapter instances and are not synchronized; call
 * them during startup.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MetricsPort metrics;
  private final ResolverPort resolver;
  private final ClockPort clock;

  /**
   * Creates a composition root with the dnsjava resolver and the system clock.
   *
   * @param metrics metrics adapter shared by constructed use cases
   */
  public CompositionRoot(MetricsPort metrics) {
    this(metrics, new DnsResolverAdapter(), ClockPort.SYSTEM);
  }

  /**
   * Creates a composition root with explicit resolver and clock overrides.
   *
   * @param metrics metrics adapter shared by constructed use cases
   * @param resolver DNS resolver port
   * @param clock time source for cache expiry
   */
  public CompositionRoot(MetricsPort metrics, ResolverPort resolver, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Resolves the scan targets.
   *
   * @param domain single validated domain
   * @param domainList domain list file
   * @return target domains in order
   * @throws IOException if the list file cannot be read
   */
  public static List<String> resolveDomains(Optional<String> domain, Optional<Path> domainList)
      throws IOException {
    if (domain.isPresent()) {
      return List.of(domain.get());
    }
    if (domainList.isPresent()) {
      return DomainListLoader.load(domainList.get());
    }
    return List.of();
  }

  /**
   * Builds the result sink chain.
   *
   * @param console console writer
   * @param showIp whether console lines include the first address
   * @param output validated text output file
   * @param jsonOutput validated JSON output file
   * @param multiDomain whether more than one domain is scanned
   * @return sink owned by the use case
   * @throws IOException if an output file cannot be opened
   */
  public ResultSinkPort resultSink(
      PrintWriter console,
      boolean showIp,
      Optional<Path> output,
      Optional<Path> jsonOutput,
      boolean multiDomain) throws IOException {
    List<ResultSinkPort> sinks = new ArrayList<>();
    sinks.add(new ConsoleResultSink(console, showIp));
    try {
      if (output.isPresent()) {
        sinks.add(new TextFileResultSink(output.get()));
      }
      if (jsonOutput.isPresent()) {
        sinks.add(new JsonFileResultSink(jsonOutput.get(), multiDomain));
      }
    } catch (IOException ex) {
      for (ResultSinkPort opened : sinks) {
        try {
          opened.close();
        } catch (IOException closeEx) {
          ex.addSuppressed(closeEx);
        }
      }
      throw ex;
    }
    return sinks.size() == 1 ? sinks.get(0) : new CompositeResultSink(sinks);
  }

  /**
   * Builds the active scan.
   *
   * @param config validated active configuration
   * @param domains target domains
   * @param resolvers validated resolver addresses; empty for the system resolver
   * @param sink result sink, closed by the use case
   * @return use case ready to run
   */
  public ActiveScanUseCase activeScanUseCase(
      ScanConfig config, List<String> domains, List<String> resolvers, ResultSinkPort sink) {
    TakeoverDetector detector = null;
    if (config.takeover()) {
      detector = new TakeoverDetector(
          new JdkHttpProbeAdapter(JdkHttpProbeAdapter.DEFAULT_TIMEOUT, config.proxy()), metrics);
    }
    log.debug(
        "Wiring active scan: domains={}, resolvers={}, takeover={}, workers={}",
        domains.size(),
        resolvers.size(),
        config.takeover(),
        config.workers());
    return new ActiveScanUseCase(
        domains,
        WordSources.open(config.wordlist().orElse(null)),
        resolver,
        resolvers,
        expected -> ResolutionCaches.forExpectedVolume(expected, config.cache(), clock),
        detector,
        sink,
        metrics,
        new ActiveScanUseCase.Settings(
            config.workers(),
            config.recursive(),
            config.depth(),
            config.showIp(),
            config.stream(),
            config.backoff()));
  }

  /**
   * Builds the passive scan.
   *
   * @param config validated passive configuration
   * @param domains target domains
   * @param resolvers validated resolver addresses; empty for the system resolver
   * @param sink result sink, closed by the use case
   * @return use case ready to run
   */
  public PassiveScanUseCase passiveScanUseCase(
      PassiveConfig config, List<String> domains, List<String> resolvers, ResultSinkPort sink) {
    PassiveEnumerationPort enumeration = new CrtShPassiveEnumerationAdapter(config.endpoint(), config.timeout());
    return new PassiveScanUseCase(domains, enumeration, resolver, resolvers, config.showIp(), sink, metrics);
  }
}
