package ca.gc.cra.subscan.domain;

import java.util.Objects;

/**
 * Body substring known to appear on a deprovisioned third-party service.
 *
 * @param service service identifier recorded on matching results
 * @param pattern literal substring searched for in the response body
 * @since 0.1.0
 */
public record TakeoverFingerprint(String service, String pattern) {

  /**
   * Validates the fingerprint.
   */
  public TakeoverFingerprint {
    Objects.requireNonNull(service, "service");
    Objects.requireNonNull(pattern, "pattern");
    if (service.isBlank() || pattern.isEmpty()) {
      throw new IllegalArgumentException("fingerprint service and pattern must not be blank");
    }
  }

  /**
   * Tests whether the body contains this fingerprint.
   *
   * @param body response body
   * @return {@code true} on a literal substring match
   */
  public boolean matches(String body) {
    return body != null && body.contains(pattern);
  }
}
