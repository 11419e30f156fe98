package ca.gc.cra.subscan.infrastructure.input;

import ca.gc.cra.subscan.application.port.WordSource;
import java.net.URI;
import java.nio.file.Path;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Factory and shared line rules for {@link WordSource} implementations.
 *
 * @since 0.1.0
 */
public final class WordSources {
  /** Wordlist fetched when no {@code wordlist} option is given. */
  public static final URI DEFAULT_WORDLIST = URI.create(
      "https://raw.githubusercontent.com/danielmiessler/SecLists/refs/heads/master/"
          + "Discovery/DNS/subdomains-top1million-110000.txt");

  private WordSources() {}

  /**
   * Picks a word source for a location.
   *
   * @param location file path, {@code http(s)} URL, or {@code null}/blank for {@link #DEFAULT_WORDLIST}
   * @return word source; nothing is read until it is streamed
   */
  public static WordSource open(String location) {
    if (location == null || location.isBlank()) {
      return new HttpWordSource(DEFAULT_WORDLIST);
    }
    String trimmed = location.trim();
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if (lower.startsWith("http://") || lower.startsWith("https://")) {
      return new HttpWordSource(URI.create(trimmed));
    }
    return new FileWordSource(Path.of(trimmed));
  }

  /**
   * Applies the word rules to raw lines: trim, drop blanks, drop {@code #} comments.
   *
   * @param lines raw lines
   * @return words
   */
  static Stream<String> words(Stream<String> lines) {
    return lines.map(String::trim).filter(line -> !line.isEmpty() && !line.startsWith("#"));
  }
}
