package ca.gc.cra.subscan.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Parsing helpers shared by the {@code fromMap} factories.
 */
final class ConfigValues {
  private ConfigValues() {}

  static Optional<String> optionalString(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  static Optional<Path> optionalPath(Map<String, String> options, String key) {
    return optionalString(options, key).map(raw -> parsePath(key, raw));
  }

  static Path parsePath(String key, String raw) {
    try {
      return Path.of(raw).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw, ex);
    }
  }

  static boolean parseBoolean(Map<String, String> options, String key, boolean defaultValue) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim();
    if (normalized.equalsIgnoreCase("true")) {
      return true;
    }
    if (normalized.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false (was " + value + ")");
  }

  static void requireSingleTarget(Optional<String> domain, Optional<Path> domainList) {
    if (domain.isEmpty() && domainList.isEmpty()) {
      throw new IllegalArgumentException("one of domain or list is required");
    }
    if (domain.isPresent() && domainList.isPresent()) {
      throw new IllegalArgumentException("domain and list are mutually exclusive");
    }
  }
}
