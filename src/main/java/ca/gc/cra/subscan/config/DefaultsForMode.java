package ca.gc.cra.subscan.config;

import ca.gc.cra.subscan.application.scan.CacheSettings;
import ca.gc.cra.subscan.infrastructure.passive.CrtShPassiveEnumerationAdapter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each SubScan mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode scan mode ({@code active} or {@code passive})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "active" -> buildActiveDefaults();
      case "passive" -> buildPassiveDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("domain", "");
    map.put("list", "");
    map.put("resolvers", "");
    map.put("showIp", "false");
    map.put("output", "");
    map.put("jsonOutput", "");
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildActiveDefaults() {
    CacheSettings cache = CacheSettings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("wordlist", "");
    map.put("rateLimit", Integer.toString(ScanConfig.DEFAULT_RATE_LIMIT_MS));
    map.put("recursive", "false");
    map.put("depth", Integer.toString(ScanConfig.DEFAULT_DEPTH));
    map.put("takeover", "false");
    map.put("proxy", "");
    map.put("workers", Integer.toString(ScanConfig.DEFAULT_WORKERS));
    map.put("stream", "false");
    map.put("cacheCapacity", Integer.toString(cache.capacity()));
    map.put("cacheTtlSeconds", Long.toString(cache.ttl().toSeconds()));
    map.put("cacheSweepSeconds", Long.toString(cache.sweepInterval().toSeconds()));
    return map;
  }

  private static Map<String, String> buildPassiveDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("passiveEndpoint", CrtShPassiveEnumerationAdapter.DEFAULT_ENDPOINT.toString());
    map.put(
        "passiveTimeoutSeconds", Long.toString(CrtShPassiveEnumerationAdapter.DEFAULT_TIMEOUT.toSeconds()));
    return map;
  }
}
