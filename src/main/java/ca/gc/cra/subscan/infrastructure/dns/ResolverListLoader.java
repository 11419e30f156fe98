package ca.gc.cra.subscan.infrastructure.dns;

import ca.gc.cra.subscan.validation.Net;
import ca.gc.cra.subscan.validation.Strings;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the {@code resolvers} option: either a comma-separated list of addresses or the path of a file with one
 * resolver per line ({@code #} starts a comment line).
 *
 * @since 0.1.0
 */
public final class ResolverListLoader {
  private static final Logger log = LoggerFactory.getLogger(ResolverListLoader.class);

  private ResolverListLoader() {}

  /**
   * Returns the resolver addresses named by {@code raw}.
   *
   * @param raw option value; blank means "use the default resolver"
   * @return validated addresses in declaration order
   * @throws ResolverListException if a resolver file cannot be read or holds an invalid entry
   * @throws IllegalArgumentException if an inline entry is invalid
   */
  public static List<String> load(String raw) throws ResolverListException {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    String value = raw.trim();
    if (looksLikeFile(value)) {
      Path path = Path.of(value);
      if (Files.isRegularFile(path)) {
        return readFile(path);
      }
    }
    List<String> addresses = new ArrayList<>();
    for (String token : Strings.splitCsv(value)) {
      addresses.add(Net.validateResolverAddress(token));
    }
    return List.copyOf(addresses);
  }

  /**
   * Reports whether a value could name a resolver file: it contains a dot and no comma.
   *
   * @param value option value
   * @return {@code true} when the value should be checked on disk
   */
  static boolean looksLikeFile(String value) {
    return value.indexOf('.') >= 0 && value.indexOf(',') < 0;
  }

  private static List<String> readFile(Path path) throws ResolverListException {
    List<String> addresses = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        try {
          addresses.add(Net.validateResolverAddress(trimmed));
        } catch (IllegalArgumentException ex) {
          throw new ResolverListException(
              "Invalid resolver '" + trimmed + "' at " + path + ":" + lineNumber, ex);
        }
      }
    } catch (IOException ex) {
      if (ex instanceof ResolverListException rle) {
        throw rle;
      }
      throw new ResolverListException("Failed to read resolver file " + path, ex);
    }
    if (addresses.isEmpty()) {
      throw new ResolverListException("Resolver file " + path + " contains no resolvers");
    }
    log.info("Loaded {} resolvers from {}", addresses.size(), path);
    return List.copyOf(addresses);
  }
}
