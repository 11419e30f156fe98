package ca.gc.cra.subscan.api;

import ca.gc.cra.subscan.application.scan.ScanReport;
import ca.gc.cra.subscan.config.CompositionRoot;
import ca.gc.cra.subscan.config.ConfigMerger;
import ca.gc.cra.subscan.config.DefaultsForMode;
import ca.gc.cra.subscan.config.YamlConfigLoader;
import ca.gc.cra.subscan.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for the active and passive CLIs: option loading, output validation, and target resolution.
 */
final class ScanCliSupport {
  private ScanCliSupport() {
    // Utility class
  }

  /**
   * Loads YAML (when {@code config=} is given) and merges it with CLI options and mode defaults.
   *
   * @param mode {@code active} or {@code passive}
   * @param kv CLI key/value options; the {@code config} key is removed
   * @param log logger of the calling CLI
   * @return merged options
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the YAML file is missing or malformed, or the merged options are invalid
   */
  static Map<String, String> effectiveOptions(String mode, Map<String, String> kv, Logger log)
      throws IOException {
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
      log.debug("Loaded {} option(s) from {}", yaml.map(Map::size).orElse(0), yamlPath);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  static OutputPaths validateOutputs(
      Optional<Path> output, Optional<Path> jsonOutput, boolean allowOverwrite, boolean createParents) {
    Optional<Path> text = output.map(path -> Paths.validateWritableFile(path, createParents, allowOverwrite));
    Optional<Path> json = jsonOutput.map(path -> Paths.validateWritableFile(path, createParents, allowOverwrite));
    if (text.isPresent() && text.equals(json)) {
      throw new IllegalArgumentException("output and jsonOutput must name different files: " + text.get());
    }
    return new OutputPaths(text, json);
  }

  static List<String> loadDomains(Optional<String> domain, Optional<Path> domainList) throws IOException {
    domainList.ifPresent(path -> Paths.requireReadableFile("list", path));
    List<String> domains = CompositionRoot.resolveDomains(domain, domainList);
    if (domains.isEmpty()) {
      throw new IllegalArgumentException("no valid domains to scan");
    }
    return domains;
  }

  static void logSummary(Logger log, String mode, List<ScanReport> reports) {
    int found = 0;
    for (ScanReport report : reports) {
      found += report.results().size();
      log.info(
          "{} scan of {} finished: {} subdomain(s), {} level(s), {} candidate(s), {} cache hit(s)",
          mode,
          report.domain(),
          report.results().size(),
          report.levels(),
          report.totalCandidates(),
          report.cacheHits());
    }
    log.info("{} scan completed: {} domain(s), {} subdomain(s)", mode, reports.size(), found);
  }

  static String orNone(Optional<?> value) {
    return value.map(Object::toString).orElse("<none>");
  }

  record OutputPaths(Optional<Path> output, Optional<Path> jsonOutput) {}
}
