package ca.gc.cra.subscan.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by SubScan CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards worker counts, rate limits, recursion depth, and cache sizing before the
 * scan engine allocates threads or memory.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., workers, ms)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer option and validates it against an inclusive range.
   *
   * @param name option name used in diagnostics
   * @param raw textual value; blank values return {@code defaultValue}
   * @param defaultValue value used when {@code raw} is {@code null} or blank
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed and validated value
   * @throws IllegalArgumentException when the value is not numeric or out of range
   */
  public static int parseInt(String name, String raw, int defaultValue, int min, int max) {
    if (raw == null || raw.isBlank()) {
      return (int) requireRange(name, defaultValue, min, max);
    }
    int parsed;
    try {
      parsed = Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + raw + ")", ex);
    }
    return (int) requireRange(name, parsed, min, max);
  }

  /**
   * Ensures a floating point factor is finite and within an inclusive range.
   *
   * @param name option name used in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (Double.isNaN(value) || Double.isInfinite(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
