package ca.gc.cra.subscan.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for SubScan CLI and configuration flows.
 * <p><strong>Why:</strong> Ensures wordlists, domain lists, and resolver files are readable before a scan starts,
 * and that result files are only written where the operator allowed it.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Normalize user-provided paths to absolute locations.</li>
 *   <li>Guard against overwriting existing result files unless explicitly approved.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} so a dangling symlink is never treated as writable output.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates an output file location, optionally creating its parent directories.
   *
   * @param path candidate result file; must not be {@code null}
   * @param createParents whether to create missing parent directories
   * @param allowOverwrite when {@code false}, an existing file is rejected
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is a directory, exists without overwrite approval, or its parent
   *     is not writable
   */
  public static Path validateWritableFile(Path path, boolean createParents, boolean allowOverwrite) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("output path is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !allowOverwrite) {
      throw new IllegalArgumentException(
          "output file " + normalized + " already exists; re-run with --allow-overwrite to replace it");
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("path has no parent to validate: " + normalized);
    }
    try {
      if (!Files.exists(parent, LinkOption.NOFOLLOW_LINKS)) {
        if (!createParents) {
          return normalized;
        }
        Files.createDirectories(parent);
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create directory " + parent + ": " + ex.getMessage(), ex);
    }
    if (!Files.isDirectory(parent)) {
      throw new IllegalArgumentException("parent is not a directory: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("parent directory is not writable: " + parent);
    }
    return normalized;
  }

  /**
   * Validates that a path names an existing, readable regular file.
   *
   * @param name option name used in diagnostics
   * @param path candidate input file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    Path normalized = normalize(path);
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " file does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " file is not readable: " + normalized);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
