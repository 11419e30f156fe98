package ca.gc.cra.subscan.application.scan;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff tuning for {@link RateController}.
 *
 * @param baseDelay delay after the first failure
 * @param maxDelay upper bound for any computed delay
 * @param factor growth factor per attempt; at least 1.0
 * @param jitter fraction of the delay added as uniform random jitter, in {@code [0, 1]}
 * @param failThreshold attempts at which a root host is treated as rate limited
 * @since 0.1.0
 */
public record BackoffSettings(
    Duration baseDelay, Duration maxDelay, double factor, double jitter, int failThreshold) {
  /** Default growth factor. */
  public static final double DEFAULT_FACTOR = 2.0d;
  /** Default jitter fraction. */
  public static final double DEFAULT_JITTER = 0.3d;
  /** Default cap on computed delays. */
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);
  /** Default attempts before proactive throttling. */
  public static final int DEFAULT_FAIL_THRESHOLD = 3;

  public BackoffSettings {
    Objects.requireNonNull(baseDelay, "baseDelay");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (baseDelay.isNegative() || maxDelay.isNegative()) {
      throw new IllegalArgumentException("backoff delays must not be negative");
    }
    if (Double.isNaN(factor) || factor < 1.0d) {
      throw new IllegalArgumentException("backoff factor must be >= 1.0");
    }
    if (Double.isNaN(jitter) || jitter < 0d || jitter > 1d) {
      throw new IllegalArgumentException("backoff jitter must be between 0 and 1");
    }
    if (failThreshold <= 0) {
      throw new IllegalArgumentException("failThreshold must be positive");
    }
  }

  /**
   * Default settings for a given rate limit: base equals the rate limit, 10s cap, factor 2, 30% jitter,
   * threshold 3.
   *
   * @param rateLimit base delay between requests to one root host
   * @return settings
   */
  public static BackoffSettings forRateLimit(Duration rateLimit) {
    return new BackoffSettings(
        rateLimit, DEFAULT_MAX_DELAY, DEFAULT_FACTOR, DEFAULT_JITTER, DEFAULT_FAIL_THRESHOLD);
  }
}
