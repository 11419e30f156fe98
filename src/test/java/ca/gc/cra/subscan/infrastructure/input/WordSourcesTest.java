package ca.gc.cra.subscan.infrastructure.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import ca.gc.cra.subscan.application.port.WordSource;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class WordSourcesTest {
  @Test
  void blankLocationFallsBackToDefaultWordlist() {
    WordSource source = WordSources.open(" ");

    assertInstanceOf(HttpWordSource.class, source);
    assertEquals(WordSources.DEFAULT_WORDLIST.toString(), source.describe());
    assertInstanceOf(HttpWordSource.class, WordSources.open(null));
  }

  @Test
  void urlsAreDownloadedAndEverythingElseIsAPath() {
    assertInstanceOf(HttpWordSource.class, WordSources.open("HTTPS://example.com/words.txt"));
    WordSource file = WordSources.open("lists/words.txt");

    assertInstanceOf(FileWordSource.class, file);
    assertEquals(Path.of("lists/words.txt").toString(), file.describe());
  }
}
