package ca.gc.cra.subscan.api;

import ca.gc.cra.subscan.application.port.MetricsPort;
import ca.gc.cra.subscan.application.port.ResultSinkPort;
import ca.gc.cra.subscan.application.scan.PassiveScanUseCase;
import ca.gc.cra.subscan.application.scan.ScanReport;
import ca.gc.cra.subscan.config.CompositionRoot;
import ca.gc.cra.subscan.config.PassiveConfig;
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
 * Entry point for passive enumeration through certificate transparency logs.
 *
 * @since 0.1.0
 */
public final class PassiveCli {
  private static final Logger log = LoggerFactory.getLogger(PassiveCli.class);
  private static final Map<String, String> FLAG_KEYS = Map.of(
      "--show-ip", "showIp",
      "--dry-run", "dryRun",
      "--allow-overwrite", "allowOverwrite");
  private static final String SUMMARY_USAGE =
      "usage: passive domain=NAME|list=PATH [--show-ip] [resolvers=IP,IP|PATH] "
          + "[output=PATH] [jsonOutput=PATH] [config=PATH] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      SubScan passive enumeration

      Usage:
        passive domain=example.com [options]

      Targets (one required):
        domain=NAME              Single root domain
        list=PATH                File of domains, one per line; blank and # lines skipped

      Optional (validated):
        --show-ip                Resolve enumerated names and include their addresses
        resolvers=IP,IP|PATH     Resolvers used with --show-ip
        passiveEndpoint=URL      Certificate transparency search endpoint (default https://crt.sh/)
        passiveTimeoutSeconds=N  Request timeout for the endpoint (default 60)
        output=PATH              Write discovered subdomains as text
        jsonOutput=PATH          Write results as JSON
        config=PATH              YAML file with common/passive sections
        --dry-run                Validate inputs and print the plan without querying
        --allow-overwrite        Replace existing output files
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL         OTLP metrics endpoint when exporter=otlp
        --verbose                Enable DEBUG logging
        --quiet                  Log warnings and errors only
        --help                   Show this message
      """;

  private PassiveCli() {}

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
   * Executes passive enumeration and maps failures to exit codes.
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
      log.debug("Verbose logging enabled for passive enumeration");
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
      effective = ScanCliSupport.effectiveOptions("passive", kv, log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid passive configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    boolean dryRun = ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite = ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Map<String, String> configInputs = new LinkedHashMap<>(effective);
    PassiveConfig config;
    ScanCliSupport.OutputPaths outputs;
    try {
      TelemetryConfigurator.configureMetrics(configInputs);
      config = PassiveConfig.fromMap(configInputs);
      outputs = ScanCliSupport.validateOutputs(config.output(), config.jsonOutput(), allowOverwrite, !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid passive arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<String> domains;
    List<String> resolvers;
    try {
      domains = ScanCliSupport.loadDomains(config.domain(), config.domainList());
      resolvers = ResolverListLoader.load(config.resolvers().orElse(null));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid passive arguments: {}", ex.getMessage());
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
      Map<String, String> plan = new LinkedHashMap<>();
      plan.put("Domains", String.join(", ", domains));
      plan.put("Endpoint", config.endpoint().toString());
      plan.put("Timeout (s)", Long.toString(config.timeout().toSeconds()));
      plan.put("Show IP", Boolean.toString(config.showIp()));
      plan.put("Resolvers", resolvers.isEmpty() ? "<system>" : String.join(", ", resolvers));
      plan.put("Text output", ScanCliSupport.orNone(outputs.output()));
      plan.put("JSON output", ScanCliSupport.orNone(outputs.jsonOutput()));
      plan.put("Allow overwrite", Boolean.toString(allowOverwrite));
      CliPrinter.printPlan(
          "Passive dry-run: no queries will be sent.", plan, "Re-run without --dry-run to start enumeration.");
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = rootFactory.apply(metrics);
      ResultSinkPort sink = root.resultSink(
          CliPrinter.writer(), config.showIp(), outputs.output(), outputs.jsonOutput(), domains.size() > 1);
      PassiveScanUseCase useCase = root.passiveScanUseCase(config, domains, resolvers, sink);
      log.info("Configured passive enumeration: domains={}, endpoint={}", domains.size(), config.endpoint());
      List<ScanReport> reports = useCase.run();
      ScanCliSupport.logSummary(log, "Passive", reports);
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Passive configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Passive enumeration I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Passive enumeration interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in passive enumeration", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
