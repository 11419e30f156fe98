package ca.gc.cra.subscan.domain;

import java.util.Locale;
import java.util.Objects;

/**
 * Fully-qualified hostname pending resolution, formed as {@code word + "." + target}.
 *
 * @param word wordlist entry that produced the candidate
 * @param target domain the word was prefixed to
 * @since 0.1.0
 */
public record Candidate(String word, String target) {

  /**
   * Normalizes the candidate parts.
   *
   * @throws IllegalArgumentException when either part is blank
   */
  public Candidate {
    Objects.requireNonNull(word, "word");
    Objects.requireNonNull(target, "target");
    word = word.trim().toLowerCase(Locale.ROOT);
    target = target.trim().toLowerCase(Locale.ROOT);
    if (word.isEmpty() || target.isEmpty()) {
      throw new IllegalArgumentException("candidate word and target must not be blank");
    }
  }

  /**
   * Returns the hostname to resolve.
   *
   * @return {@code word.target}
   */
  public String hostname() {
    return word + "." + target;
  }

  @Override
  public String toString() {
    return hostname();
  }
}
