package ca.gc.cra.subscan.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers for scan diagnostics.
 * <p><strong>Why:</strong> Probe responses and resolver errors can be large or noisy; these helpers keep log
 * lines bounded and readable.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    int end = maxBytes;
    // back off to a code point boundary
    while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
      end--;
    }
    String truncated = new String(bytes, 0, end, StandardCharsets.UTF_8);
    return truncated + "... (truncated, " + end + " of " + bytes.length + ")";
  }

  /**
   * Describes the innermost cause of a failure as {@code Type: message} for single-line debug logs.
   *
   * @param error failure to describe; {@code null} yields {@code "<null>"}
   * @return short description of the root cause
   */
  public static String rootCause(Throwable error) {
    if (error == null) {
      return NULL_PLACEHOLDER;
    }
    Throwable current = error;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    String message = current.getMessage();
    String type = current.getClass().getSimpleName();
    return message == null ? type : type + ": " + message;
  }
}
