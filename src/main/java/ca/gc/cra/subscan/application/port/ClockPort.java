package ca.gc.cra.subscan.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to cache expiry and scan timing.
 * <p><strong>Why:</strong> TTL expiry must be testable without sleeping; tests inject a manual clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; clock reads happen on every worker.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
