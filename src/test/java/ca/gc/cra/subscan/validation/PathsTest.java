package ca.gc.cra.subscan.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void createsParentsOnlyWhenAsked() {
    Path target = tempDir.resolve("a").resolve("b").resolve("out.txt");

    assertEquals(target, Paths.validateWritableFile(target, false, false));
    assertFalse(Files.exists(target.getParent()));

    Paths.validateWritableFile(target, true, false);
    assertTrue(Files.isDirectory(target.getParent()));
  }

  @Test
  void existingFileNeedsOverwritePermission() throws Exception {
    Path target = tempDir.resolve("out.txt");
    Files.writeString(target, "x", StandardCharsets.UTF_8);

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableFile(target, true, false));
    assertEquals(target, Paths.validateWritableFile(target, true, true));
  }

  @Test
  void directoriesAreNotOutputFiles() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableFile(tempDir, true, true));
  }

  @Test
  void readableFileMustExist() throws Exception {
    Path list = tempDir.resolve("domains.txt");
    Files.writeString(list, "example.com\n", StandardCharsets.UTF_8);

    assertEquals(list, Paths.requireReadableFile("list", list));
    IllegalArgumentException thrown = assertThrows(
        IllegalArgumentException.class, () -> Paths.requireReadableFile("list", tempDir.resolve("absent")));
    assertTrue(thrown.getMessage().startsWith("list file does not exist"));
  }
}
