package ca.gc.cra.subscan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void mergesCommonAndModeSections() throws Exception {
    Path file = write("""
        common:
          resolvers: [8.8.8.8, 1.1.1.1]
          showIp: true
        active:
          depth: 3
          recursive: true
          cache:
            capacity: 500
        passive:
          passiveTimeoutSeconds: 30
        """);

    Map<String, String> active = YamlConfigLoader.load(file, "active").orElseThrow();

    assertEquals("8.8.8.8,1.1.1.1", active.get("resolvers"));
    assertEquals("true", active.get("showIp"));
    assertEquals("3", active.get("depth"));
    assertEquals("true", active.get("recursive"));
    assertEquals("500", active.get("cache.capacity"));
    assertFalse(active.containsKey("passiveTimeoutSeconds"));

    Map<String, String> passive = YamlConfigLoader.load(file, "PASSIVE").orElseThrow();
    assertEquals("30", passive.get("passiveTimeoutSeconds"));
    assertFalse(passive.containsKey("depth"));
  }

  @Test
  void modeSectionOverridesCommon() throws Exception {
    Path file = write("""
        common:
          workers: 5
        active:
          workers: 50
        """);

    assertEquals("50", YamlConfigLoader.load(file, "active").orElseThrow().get("workers"));
  }

  @Test
  void missingFileYieldsEmpty() throws Exception {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "active"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws Exception {
    assertTrue(YamlConfigLoader.load(write(""), "active").orElseThrow().isEmpty());
  }

  @Test
  void nullValuesBecomeBlank() throws Exception {
    Path file = write("""
        active:
          wordlist:
        """);

    assertEquals("", YamlConfigLoader.load(file, "active").orElseThrow().get("wordlist"));
  }

  @Test
  void rejectsMalformedDocuments() throws Exception {
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(write("active: [unclosed"), "active"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(write("- a\n- b\n"), "active"));
    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(write("active: 5\n"), "active"));
    assertThrows(
        IllegalArgumentException.class,
        () -> YamlConfigLoader.load(write("active:\n  resolvers:\n    - {a: 1}\n"), "active"));
  }

  @Test
  void refusesArbitraryTypeTags() throws Exception {
    Path file = write("active: !!java.io.File [\"/tmp\"]\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "active"));
  }

  private Path write(String yaml) throws Exception {
    Path file = Files.createTempFile(tempDir, "subscan", ".yaml");
    Files.writeString(file, yaml, StandardCharsets.UTF_8);
    return file;
  }
}
