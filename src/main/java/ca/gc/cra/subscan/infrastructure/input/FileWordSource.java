package ca.gc.cra.subscan.infrastructure.input;

import ca.gc.cra.subscan.application.port.WordSource;
import ca.gc.cra.subscan.application.port.WordlistLoadException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.stream.Stream;

/**
 * Reads words lazily from a UTF-8 text file, one per line.
 *
 * @since 0.1.0
 */
public final class FileWordSource implements WordSource {
  private final Path path;

  /**
   * Creates a source for {@code path}; the file is not opened until {@link #stream()}.
   *
   * @param path wordlist file
   */
  public FileWordSource(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  public Stream<String> stream() throws WordlistLoadException {
    try {
      return WordSources.words(Files.lines(path, StandardCharsets.UTF_8));
    } catch (NoSuchFileException ex) {
      throw new WordlistLoadException("Wordlist file not found: " + path, ex);
    } catch (IOException ex) {
      throw new WordlistLoadException("Failed to open wordlist " + path, ex);
    }
  }

  @Override
  public OptionalLong knownSize() throws WordlistLoadException {
    try (Stream<String> words = stream()) {
      return OptionalLong.of(words.count());
    } catch (UncheckedIOException ex) {
      throw new WordlistLoadException("Failed to read wordlist " + path, ex.getCause());
    }
  }

  @Override
  public String describe() {
    return path.toString();
  }
}
