package ca.gc.cra.subscan.application.scan;

import java.util.List;
import java.util.Objects;

/**
 * Frontier of one breadth pass.
 *
 * @param level one-based recursion level
 * @param targets hostnames expanded with every word at this level
 * @since 0.1.0
 */
public record ScanLevel(int level, List<String> targets) {
  public ScanLevel {
    if (level < 1) {
      throw new IllegalArgumentException("level must be >= 1");
    }
    targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
  }

  /**
   * Builds the next frontier from this level's discoveries.
   *
   * @param discovered hostnames found at this level
   * @return level {@code level + 1}
   */
  public ScanLevel next(List<String> discovered) {
    return new ScanLevel(level + 1, discovered);
  }
}
