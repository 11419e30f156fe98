package ca.gc.cra.subscan.api;

import ca.gc.cra.subscan.application.port.MetricsPort;
import ca.gc.cra.subscan.application.port.ResultSinkPort;
import ca.gc.cra.subscan.application.scan.ActiveScanUseCase;
import ca.gc.cra.subscan.application.scan.ScanReport;
import ca.gc.cra.subscan.config.CompositionRoot;
import ca.gc.cra.subscan.config.ScanConfig;
import ca.gc.cra.subscan.infrastructure.dns.ResolverListException;
import ca.gc.cra.subscan.infrastructure.dns.ResolverListLoader;
import ca.gc.cra.subscan.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.subscan.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the active scan: wordlist brute-force with optional recursion and takeover checks.
 *
 * @since 0.1.0
 */
public final class ActiveCli {
  private static final Logger log = LoggerFactory.getLogger(ActiveCli.class);
  private static final Map<String, String> FLAG_KEYS = Map.of(
      "--recursive", "recursive",
      "--show-ip", "showIp",
      "--takeover", "takeover",
      "--stream", "stream",
      "--dry-run", "dryRun",
      "--allow-overwrite", "allowOverwrite");
  private static final String SUMMARY_USAGE =
      "usage: active domain=NAME|list=PATH [wordlist=PATH|URL] [resolvers=IP,IP|PATH] [rateLimit=MS] "
          + "[workers=N] [--recursive] [depth=N] [--show-ip] [--takeover] [proxy=URL] [--stream] "
          + "[output=PATH] [jsonOutput=PATH] [config=PATH] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      SubScan active scan

      Usage:
        active domain=example.com [options]

      Targets (one required):
        domain=NAME              Single root domain (http://, https://, www. prefixes are stripped)
        list=PATH                File of domains, one per line; blank and # lines skipped

      Optional (validated):
        wordlist=PATH|URL        Candidate words; defaults to the SecLists top-110000 list
        resolvers=IP,IP|PATH     Resolvers tried in order, or a file with one per line
        rateLimit=MS             Base backoff delay per root host (default 100)
        workers=N                Resolver threads per level (default 10)
        --recursive              Scan discovered subdomains as new targets
        depth=N                  Last recursion level, -1 for unlimited (default 1)
        --show-ip                Include resolved addresses in results
        --takeover               Fingerprint discovered hosts for subdomain takeover
        proxy=URL                HTTP proxy for takeover probes (http://host:port)
        --stream                 Stream the wordlist even when it is small
        output=PATH              Write discovered subdomains as text
        jsonOutput=PATH          Write results as JSON
        cacheCapacity=N          Bounded cache capacity for large scans (default 10000)
        cacheTtlSeconds=N        Bounded cache entry lifetime (default 1800)
        cacheSweepSeconds=N      Background expiry sweep period, 0 disables (default 300)
        config=PATH              YAML file with common/active sections
        --dry-run                Validate inputs and print the plan without scanning
        --allow-overwrite        Replace existing output files
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL         OTLP metrics endpoint when exporter=otlp
        --verbose                Enable DEBUG logging
        --quiet                  Log warnings and errors only
        --help                   Show this message
      """;

  private ActiveCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the active scan and maps failures to exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, CompositionRoot::new);
  }

  static ExitCode run(String[] args, Function<MetricsPort, CompositionRoot> rootFactory) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for active scan");
    } else if (input.quiet()) {
      LoggingConfigurator.enableQuietLogging();
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    ConfigCliUtils.applyFlags(input, kv, FLAG_KEYS, log);

    Map<String, String> effective;
    try {
      effective = ScanCliSupport.effectiveOptions("active", kv, log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid active scan configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    boolean dryRun = ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite = ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    String metricsExporter = effective.getOrDefault("metricsExporter", "none");
    ScanConfig config;
    ScanCliSupport.OutputPaths outputs;
    try {
      TelemetryConfigurator.configureMetrics(configInputs);
      config = ScanConfig.fromMap(configInputs);
      outputs = ScanCliSupport.validateOutputs(config.output(), config.jsonOutput(), allowOverwrite, !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid active scan arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<String> domains;
    List<String> resolvers;
    try {
      domains = ScanCliSupport.loadDomains(config.domain(), config.domainList());
      resolvers = ResolverListLoader.load(config.resolvers().orElse(null));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid active scan arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (ResolverListException ex) {
      log.error("Invalid resolver list: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read domain list {}", config.domainList().orElse(null), ex);
      return ExitCode.IO_ERROR;
    }

    if (dryRun) {
      printDryRunPlan(config, domains, resolvers, outputs, allowOverwrite);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = rootFactory.apply(metrics);
      ResultSinkPort sink = root.resultSink(
          CliPrinter.writer(), config.showIp(), outputs.output(), outputs.jsonOutput(), domains.size() > 1);
      ActiveScanUseCase useCase = root.activeScanUseCase(config, domains, resolvers, sink);
      log.info(
          "Configured active scan: domains={}, workers={}, recursive={}, depth={}, takeover={}, "
              + "metricsExporter={}",
          domains.size(),
          config.workers(),
          config.recursive(),
          config.depth(),
          config.takeover(),
          metricsExporter);
      List<ScanReport> reports = useCase.run();
      ScanCliSupport.logSummary(log, "Active", reports);
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Active scan configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Active scan I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Active scan interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in active scan", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(
      ScanConfig config,
      List<String> domains,
      List<String> resolvers,
      ScanCliSupport.OutputPaths outputs,
      boolean allowOverwrite) {
    Map<String, String> plan = new LinkedHashMap<>();
    plan.put("Domains", String.join(", ", domains));
    plan.put("Wordlist", config.wordlist().orElse("<default SecLists>"));
    plan.put("Resolvers", resolvers.isEmpty() ? "<system>" : String.join(", ", resolvers));
    plan.put("Workers", Integer.toString(config.workers()));
    plan.put("Rate limit (ms)", Long.toString(config.rateLimit().toMillis()));
    plan.put("Recursive", Boolean.toString(config.recursive()));
    plan.put("Depth", config.depth() < 0 ? "unlimited" : Integer.toString(config.depth()));
    plan.put("Show IP", Boolean.toString(config.showIp()));
    plan.put("Takeover checks", Boolean.toString(config.takeover()));
    plan.put("Proxy", ScanCliSupport.orNone(config.proxy()));
    plan.put("Force streaming", Boolean.toString(config.stream()));
    plan.put("Cache", "capacity=" + config.cache().capacity()
        + " ttl=" + config.cache().ttl().toSeconds() + "s"
        + " sweep=" + config.cache().sweepInterval().toSeconds() + "s");
    plan.put("Text output", ScanCliSupport.orNone(outputs.output()));
    plan.put("JSON output", ScanCliSupport.orNone(outputs.jsonOutput()));
    plan.put("Allow overwrite", Boolean.toString(allowOverwrite));
    CliPrinter.printPlan(
        "Active scan dry-run: no DNS queries will be sent.", plan, "Re-run without --dry-run to start scanning.");
  }
}
