package ca.gc.cra.subscan.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and cross-key rules.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode scan mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked for overrides and ignored settings
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> warnings = warn == null ? message -> { } : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    // A target given on the command line replaces the other target kind from YAML.
    if (cliCopy.containsKey("domain") && !cliCopy.containsKey("list")) {
      merged.remove("list");
    }
    if (cliCopy.containsKey("list") && !cliCopy.containsKey("domain")) {
      merged.remove("domain");
    }
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key)) {
        warnings.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged, warnings);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective, Consumer<String> warn) {
    if (!"active".equalsIgnoreCase(mode)) {
      return;
    }
    boolean takeover = parseBoolean(effective.get("takeover"));
    if (!takeover && !trim(effective.get("proxy")).isEmpty()) {
      warn.accept("proxy is only used for takeover checks; ignoring it without --takeover");
    }
    boolean recursive = parseBoolean(effective.get("recursive"));
    String depth = trim(effective.get("depth"));
    if (!recursive && !depth.isEmpty() && !depth.equals("1")) {
      warn.accept("depth=" + depth + " has no effect without --recursive");
    }
  }

  private static boolean parseBoolean(String value) {
    return value != null && Boolean.parseBoolean(value.trim());
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
