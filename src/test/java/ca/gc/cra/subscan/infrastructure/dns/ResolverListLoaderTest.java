package ca.gc.cra.subscan.infrastructure.dns;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResolverListLoaderTest {
  @TempDir Path tempDir;

  @Test
  void blankMeansDefaultResolver() throws Exception {
    assertEquals(List.of(), ResolverListLoader.load(null));
    assertEquals(List.of(), ResolverListLoader.load("  "));
  }

  @Test
  void parsesCommaSeparatedAddresses() throws Exception {
    assertEquals(
        List.of("8.8.8.8", "2001:db8::53", "dns.example.net"),
        ResolverListLoader.load("8.8.8.8, [2001:db8::53] ,dns.example.net"));
  }

  @Test
  void singleAddressIsNotMistakenForAFile() throws Exception {
    assertEquals(List.of("1.1.1.1"), ResolverListLoader.load("1.1.1.1"));
  }

  @Test
  void readsResolverFileSkippingComments() throws Exception {
    Path file = tempDir.resolve("resolvers.txt");
    Files.writeString(file, "# primary\n9.9.9.9\n\n149.112.112.112\n", StandardCharsets.UTF_8);

    assertEquals(List.of("9.9.9.9", "149.112.112.112"), ResolverListLoader.load(file.toString()));
  }

  @Test
  void reportsInvalidLineWithLocation() throws Exception {
    Path file = tempDir.resolve("resolvers.txt");
    Files.writeString(file, "9.9.9.9\n300.1.1.1\n", StandardCharsets.UTF_8);

    ResolverListException thrown =
        assertThrows(ResolverListException.class, () -> ResolverListLoader.load(file.toString()));
    assertTrue(thrown.getMessage().endsWith(":2"), thrown.getMessage());
  }

  @Test
  void emptyResolverFileIsRejected() throws Exception {
    Path file = tempDir.resolve("resolvers.txt");
    Files.writeString(file, "# nothing here\n", StandardCharsets.UTF_8);

    assertThrows(ResolverListException.class, () -> ResolverListLoader.load(file.toString()));
  }

  @Test
  void malformedInlineAddressIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ResolverListLoader.load("8.8.8.8,bad host"));
  }
}
