package ca.gc.cra.subscan.infrastructure.input;

import ca.gc.cra.subscan.validation.Domains;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads target domains from a file, one per line. Blank and {@code #} lines are skipped, each entry is cleaned
 * with {@link Domains#clean(String)}, and invalid entries are logged and dropped.
 *
 * @since 0.1.0
 */
public final class DomainListLoader {
  private static final Logger log = LoggerFactory.getLogger(DomainListLoader.class);

  private DomainListLoader() {}

  /**
   * Loads the domains in {@code path}.
   *
   * @param path domain list file
   * @return distinct lowercase domains in file order
   * @throws IOException if the file cannot be read
   */
  public static List<String> load(Path path) throws IOException {
    Set<String> domains = new LinkedHashSet<>();
    try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
      WordSources.words(lines).forEach(line -> {
        String cleaned = Domains.clean(line);
        if (cleaned.isEmpty()) {
          return;
        }
        if (!Domains.isValid(cleaned)) {
          log.warn("Skipping invalid domain '{}' in {}", line, path);
          return;
        }
        domains.add(cleaned.toLowerCase(Locale.ROOT));
      });
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    }
    log.info("Loaded {} domain(s) from {}", domains.size(), path);
    return List.copyOf(domains);
  }
}
