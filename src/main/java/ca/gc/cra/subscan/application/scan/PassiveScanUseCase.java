package ca.gc.cra.subscan.application.scan;

import ca.gc.cra.subscan.application.port.MetricsPort;
import ca.gc.cra.subscan.application.port.PassiveEnumerationPort;
import ca.gc.cra.subscan.application.port.ResolutionException;
import ca.gc.cra.subscan.application.port.ResolverPort;
import ca.gc.cra.subscan.application.port.ResultSinkPort;
import ca.gc.cra.subscan.domain.SubdomainResult;
import ca.gc.cra.subscan.logging.Logs;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Enumerates subdomains from an external aggregation source and forwards them to the result sink, optionally
 * attaching resolved addresses.
 * <p>A domain whose enumeration fails is logged and skipped; the run fails only when every domain failed.</p>
 *
 * @since 0.1.0
 */
public final class PassiveScanUseCase {
  private static final Logger log = LoggerFactory.getLogger(PassiveScanUseCase.class);

  private final List<String> domains;
  private final PassiveEnumerationPort enumeration;
  private final ResolverPort resolver;
  private final List<String> resolvers;
  private final boolean showIp;
  private final ResultSinkPort sink;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param domains cleaned root domains
   * @param enumeration passive source
   * @param resolver resolver used when {@code showIp} is set
   * @param resolvers resolver addresses tried in order; empty for the default resolver
   * @param showIp whether results carry resolved addresses
   * @param sink destination for results; closed by {@link #run()}
   * @param metrics metrics sink
   */
  public PassiveScanUseCase(
      List<String> domains,
      PassiveEnumerationPort enumeration,
      ResolverPort resolver,
      List<String> resolvers,
      boolean showIp,
      ResultSinkPort sink,
      MetricsPort metrics) {
    this.domains = List.copyOf(Objects.requireNonNull(domains, "domains"));
    if (this.domains.isEmpty()) {
      throw new IllegalArgumentException("at least one domain is required");
    }
    this.enumeration = Objects.requireNonNull(enumeration, "enumeration");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.resolvers = List.copyOf(Objects.requireNonNull(resolvers, "resolvers"));
    this.showIp = showIp;
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Enumerates every domain.
   *
   * @return one report per successfully enumerated domain
   * @throws IOException if every enumeration failed or the sink fails
   * @throws InterruptedException if the calling thread is interrupted
   */
  public List<ScanReport> run() throws IOException, InterruptedException {
    MDC.put("pipeline", "passive");
    List<ScanReport> reports = new ArrayList<>();
    IOException lastFailure = null;
    boolean completed = false;
    try {
      for (String domain : domains) {
        MDC.put("domain", domain);
        try {
          reports.add(enumerateDomain(domain));
        } catch (IOException ex) {
          lastFailure = ex;
          log.warn("Passive enumeration of {} failed: {}", domain, Logs.rootCause(ex));
        } finally {
          MDC.remove("domain");
        }
      }
      if (reports.isEmpty() && lastFailure != null) {
        throw new IOException("Passive enumeration failed for every domain", lastFailure);
      }
      completed = true;
    } finally {
      try {
        sink.close();
      } catch (IOException closeFailure) {
        log.error("Failed to close result sink", closeFailure);
        if (completed) {
          throw closeFailure;
        }
      } finally {
        MDC.remove("pipeline");
      }
    }
    return reports;
  }

  private ScanReport enumerateDomain(String domain) throws IOException, InterruptedException {
    List<String> hostnames = enumeration.enumerate(domain);
    Set<String> distinct = new LinkedHashSet<>();
    for (String hostname : hostnames) {
      if (hostname != null && !hostname.isBlank()) {
        distinct.add(hostname.trim().toLowerCase(Locale.ROOT));
      }
    }
    log.info("Passive source returned {} distinct hostname(s) for {}", distinct.size(), domain);

    sink.beginDomain(domain);
    List<SubdomainResult> results = new ArrayList<>(distinct.size());
    long failures = 0;
    for (String hostname : distinct) {
      SubdomainResult result = SubdomainResult.of(hostname);
      if (showIp) {
        List<String> addresses = lookup(hostname);
        if (addresses.isEmpty()) {
          failures++;
          metrics.increment("scan.resolve.failure");
        } else {
          metrics.increment("scan.resolve.success");
          result = result.withIps(addresses);
        }
      }
      sink.accept(result);
      results.add(result);
    }
    sink.endDomain(domain, results.size());
    return new ScanReport(domain, List.of((long) distinct.size()), results, 0L, failures);
  }

  private List<String> lookup(String hostname) throws InterruptedException {
    if (resolvers.isEmpty()) {
      try {
        return resolver.lookup(hostname);
      } catch (ResolutionException ex) {
        log.debug("{} did not resolve: {}", hostname, ex.getMessage());
        return List.of();
      }
    }
    for (String address : resolvers) {
      try {
        List<String> found = resolver.lookup(hostname, address);
        if (!found.isEmpty()) {
          return found;
        }
      } catch (ResolutionException ex) {
        log.debug("{} did not resolve via {}: {}", hostname, address, ex.getMessage());
      }
    }
    return List.of();
  }
}
