package ca.gc.cra.subscan.api;

import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;

/**
 * Shared helpers for mixing CLI flag semantics with YAML/Map based configuration sources.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Copies boolean flags into the key/value map as {@code key=true}; unknown flags are logged and ignored.
   *
   * @param input parsed CLI input
   * @param kv mutable key/value map
   * @param flagKeys flag to option key mapping, e.g. {@code --show-ip -> showIp}
   * @param log logger of the calling CLI
   */
  static void applyFlags(CliInput input, Map<String, String> kv, Map<String, String> flagKeys, Logger log) {
    Set<String> handled = Set.of("--help", "--verbose", "--quiet");
    for (String flag : input.flags()) {
      String key = flagKeys.get(flag);
      if (key != null) {
        kv.put(key, "true");
      } else if (!handled.contains(flag)) {
        log.warn("Ignoring unknown flag {}", flag);
      }
    }
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    return parseBoolean(map, key, false);
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    if (map == null) {
      return defaultValue;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
