package ca.gc.cra.subscan.infrastructure.input;

import ca.gc.cra.subscan.application.port.WordSource;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.stream.Stream;

/**
 * Word source over a pre-loaded list. Entries follow the same rules as file lines.
 *
 * @since 0.1.0
 */
public final class InMemoryWordSource implements WordSource {
  private final List<String> words;

  /**
   * Creates a source over {@code entries}.
   *
   * @param entries raw entries; blanks and {@code #} comments are skipped
   */
  public InMemoryWordSource(List<String> entries) {
    this.words = WordSources.words(Objects.requireNonNull(entries, "entries").stream()).toList();
  }

  @Override
  public Stream<String> stream() {
    return words.stream();
  }

  @Override
  public OptionalLong knownSize() {
    return OptionalLong.of(words.size());
  }

  @Override
  public String describe() {
    return "in-memory list (" + words.size() + " words)";
  }
}
