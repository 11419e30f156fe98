package ca.gc.cra.subscan.application.port;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.OptionalLong;
import java.util.stream.Stream;

/**
 * <strong>What:</strong> Streaming producer of candidate words from a file, remote resource, or in-memory list.
 * <p><strong>Contract:</strong> Each {@link #stream()} yields a fresh, lazily-read stream of non-empty trimmed words,
 * one per newline-delimited record, skipping {@code #} comments. Callers must close the stream.</p>
 * <p><strong>Failure semantics:</strong> Opening failures raise {@link WordlistLoadException}; read failures
 * part-way through surface as {@link java.io.UncheckedIOException} wrapping a {@link WordlistLoadException}.</p>
 * <p><strong>Lifecycle:</strong> The owner closes the source once every pass is done; sources holding local
 * copies of remote data release them on {@link #close()}.</p>
 *
 * @since 0.1.0
 */
public interface WordSource extends AutoCloseable {
  /**
   * Opens a new pass over the words.
   *
   * @return lazily-populated stream of words
   * @throws WordlistLoadException when the source cannot be opened
   */
  Stream<String> stream() throws WordlistLoadException;

  /**
   * Human-readable location used in logs and error messages.
   *
   * @return source description
   */
  String describe();

  /**
   * Materializes every word into memory.
   *
   * @return immutable list of words in source order
   * @throws WordlistLoadException when the source cannot be read
   */
  default List<String> readAll() throws WordlistLoadException {
    try (Stream<String> words = stream()) {
      return words.toList();
    } catch (UncheckedIOException ex) {
      throw new WordlistLoadException("Failed to read wordlist " + describe(), ex.getCause());
    }
  }

  /**
   * Returns the number of words when it can be determined without a network fetch.
   *
   * @return word count, or empty when unknown
   * @throws WordlistLoadException when a local source cannot be read
   */
  default OptionalLong knownSize() throws WordlistLoadException {
    return OptionalLong.empty();
  }

  /**
   * Releases resources held between passes. The default implementation holds none.
   *
   * @throws IOException if a resource cannot be released
   */
  @Override
  default void close() throws IOException {}
}
